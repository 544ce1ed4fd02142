package personal.pair.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.pair.booking.domain.model.CleanupReport;
import personal.pair.booking.domain.model.HeldSlots;
import personal.pair.booking.domain.model.PairResult;
import personal.pair.booking.domain.model.Side;
import personal.pair.booking.domain.model.SideResult;
import personal.pair.booking.domain.model.SlotFailure;
import personal.pair.booking.domain.service.PairBookingManager;
import personal.pair.booking.domain.service.ReservationServicePair;
import personal.pair.common.exception.BusinessException;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;

/**
 * Cleanup Engine
 * "짝 슬롯은 최대 하나, 짝 없는 슬롯은 없음" 상태를 유지하기 위한 정리 작업
 * - 보유 한도를 비우기 위한 선제 정리 (reserveEarliest 시작 시)
 * - 예약 성공 후 뒷정리
 *
 * 개별 슬롯 실패는 전체 작업을 중단시키지 않고 CleanupReport 에 모아서 보고한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CleanupEngine {

    private static final String LIST_HELD = "list held";
    private static final String RELEASE_UNMATCHED = "release unmatched";
    private static final String CANCEL_PAIR = "cancel later pair";
    private static final String RELEASE = "release";

    private final ReservationServicePair services;
    private final PairBookingManager bookingManager;

    /**
     * 짝 없는 슬롯을 모두 반납하고, 짝이 여러 개면 가장 이른 것만 남긴다
     */
    public CleanupReport cancelAllUnmatched() {
        HeldSlots held;
        try {
            held = services.heldSlots();
        } catch (BusinessException e) {
            log.warn("Cleanup skipped, could not read held slots: {}", e.getMessage());
            return CleanupReport.failed(SlotFailure.from(e, null, null, LIST_HELD));
        }

        Sweep sweep = new Sweep();
        releaseUnmatched(held, sweep);

        SortedSet<Integer> matched = held.matchedPairs();
        if (!matched.isEmpty()) {
            int earliest = matched.first();
            for (int slotId : matched) {
                if (slotId == earliest) {
                    continue;
                }
                log.info("Cancelling later matching pair: slotId={}", slotId);
                PairResult result = bookingManager.cancelBoth(slotId);
                if (result.succeeded()) {
                    sweep.cancelledPairs.add(slotId);
                } else {
                    sweep.failures.add(pairFailure(result));
                    sweep.inconsistent |= result.inconsistent();
                }
            }
            sweep.keptPair = earliest;
            if (matched.size() > 1) {
                log.info("Kept earliest matching pair: slotId={}", earliest);
            }
        }

        CleanupReport report = sweep.toReport();
        log.info("Unmatched slots cleanup completed: releasedHotel={}, releasedBand={}, cancelledPairs={}, failures={}",
                report.releasedHotel(), report.releasedBand(), report.cancelledPairs(), report.failures().size());
        return report;
    }

    /**
     * 주어진 스냅샷 기준으로 짝 없는 슬롯만 반납 (짝 슬롯은 건드리지 않음)
     */
    public CleanupReport releaseUnmatched(HeldSlots held) {
        Sweep sweep = new Sweep();
        releaseUnmatched(held, sweep);
        return sweep.toReport();
    }

    /**
     * 보유 중인 모든 슬롯 반납
     */
    public CleanupReport cancelEverything() {
        HeldSlots held;
        try {
            held = services.heldSlots();
        } catch (BusinessException e) {
            log.warn("Cancel all skipped, could not read held slots: {}", e.getMessage());
            return CleanupReport.failed(SlotFailure.from(e, null, null, LIST_HELD));
        }

        Sweep sweep = new Sweep();
        for (Side side : Side.values()) {
            for (int slotId : held.get(side)) {
                release(side, slotId, RELEASE, sweep);
            }
        }

        CleanupReport report = sweep.toReport();
        if (report.failures().isEmpty()) {
            log.info("Cancelled all slots: hotel={}, band={}", report.releasedHotel(), report.releasedBand());
        } else {
            log.warn("Some slots could not be cancelled: {}", report.failures());
        }
        return report;
    }

    private void releaseUnmatched(HeldSlots held, Sweep sweep) {
        for (Side side : Side.values()) {
            for (int slotId : held.unmatched().get(side)) {
                log.info("Cancelling unmatched {} slot: slotId={}", side.label(), slotId);
                release(side, slotId, RELEASE_UNMATCHED, sweep);
            }
        }
    }

    private void release(Side side, int slotId, String operation, Sweep sweep) {
        try {
            services.release(side, slotId);
            sweep.released(side).add(slotId);
        } catch (BusinessException e) {
            log.warn("Failed to cancel {} slot: slotId={}, reason={}", side.label(), slotId, e.getMessage());
            sweep.failures.add(SlotFailure.from(e, side, slotId, operation));
        }
    }

    private SlotFailure pairFailure(PairResult result) {
        String detail = result.inconsistent()
                ? "rollback failed, system may be inconsistent"
                : result.firstFailure().map(SideResult::detail).orElse("cancel failed");
        SideResult failed = result.firstFailure().orElse(null);
        return new SlotFailure(
                failed == null ? null : failed.side(),
                result.slotId(),
                CANCEL_PAIR,
                failed == null ? null : failed.errorCode(),
                detail);
    }

    private static final class Sweep {
        private final List<Integer> releasedHotel = new ArrayList<>();
        private final List<Integer> releasedBand = new ArrayList<>();
        private final List<Integer> cancelledPairs = new ArrayList<>();
        private final List<SlotFailure> failures = new ArrayList<>();
        private Integer keptPair;
        private boolean inconsistent;

        private List<Integer> released(Side side) {
            return side == Side.HOTEL ? releasedHotel : releasedBand;
        }

        private CleanupReport toReport() {
            return new CleanupReport(releasedHotel, releasedBand, cancelledPairs, keptPair, failures, inconsistent);
        }
    }
}
