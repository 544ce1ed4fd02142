package personal.pair.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.pair.booking.domain.model.HeldSlots;
import personal.pair.booking.domain.model.PairOperation;
import personal.pair.booking.domain.model.PairResult;
import personal.pair.booking.domain.model.Receipt;
import personal.pair.booking.domain.model.Side;
import personal.pair.booking.domain.model.SideResult;
import personal.pair.common.exception.BusinessException;

import java.util.Set;

/**
 * Pair Booking Manager (Saga Executor)
 * 두 서비스에 걸친 예약/취소를 보상 트랜잭션으로 원자적으로 보이게 만드는 실행 전용 서비스
 *
 * 순서 규칙: 항상 HOTEL → BAND. 두 번째가 실패하면 첫 번째를 되돌린다
 * - 예약: BAND 실패 → HOTEL 반납
 * - 취소: BAND 실패 → HOTEL 재예약
 * 보상 자체가 실패하면 PairResult.inconsistent 로 표시 (재시도하지 않음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PairBookingManager {

    private final ReservationServicePair services;

    public PairResult reserveBoth(int slotId) {
        return runBoth(slotId, PairOperation.RESERVE);
    }

    public PairResult cancelBoth(int slotId) {
        return runBoth(slotId, PairOperation.CANCEL);
    }

    /**
     * 한쪽만 예약 (되돌릴 것이 없으므로 보상 없음)
     */
    public PairResult reserveOne(int slotId, Side side) {
        return runOne(slotId, PairOperation.RESERVE, side);
    }

    public PairResult cancelOne(int slotId, Side side) {
        return runOne(slotId, PairOperation.CANCEL, side);
    }

    /**
     * 요청한 쪽 중 아직 보유하지 않은 쪽만 예약
     * 이미 보유 중인 쪽은 원격 호출 없이 ALREADY_HELD 로 처리
     */
    public PairResult reserveMissing(int slotId, Set<Side> requested, HeldSlots held) {
        boolean needHotel = requested.contains(Side.HOTEL) && !held.holds(Side.HOTEL, slotId);
        boolean needBand = requested.contains(Side.BAND) && !held.holds(Side.BAND, slotId);

        if (needHotel && needBand) {
            return reserveBoth(slotId);
        }

        SideResult hotel = needHotel ? execute(PairOperation.RESERVE, Side.HOTEL, slotId)
                : settled(Side.HOTEL, requested);
        SideResult band = needBand ? execute(PairOperation.RESERVE, Side.BAND, slotId)
                : settled(Side.BAND, requested);
        return PairResult.of(slotId, PairOperation.RESERVE, hotel, band);
    }

    private PairResult runBoth(int slotId, PairOperation operation) {
        SideResult first = execute(operation, Side.HOTEL, slotId);
        if (first.isFailed()) {
            return PairResult.of(slotId, operation, first, SideResult.skipped(Side.BAND));
        }

        SideResult second = execute(operation, Side.BAND, slotId);
        if (!second.isFailed()) {
            log.info("Pair {} completed: slotId={}", operation.verb(), slotId);
            return PairResult.of(slotId, operation, first, second);
        }

        return compensate(slotId, operation, first, second);
    }

    private PairResult runOne(int slotId, PairOperation operation, Side side) {
        SideResult result = execute(operation, side, slotId);
        SideResult other = SideResult.notRequested(side.other());
        return side == Side.HOTEL
                ? PairResult.of(slotId, operation, result, other)
                : PairResult.of(slotId, operation, other, result);
    }

    private SideResult execute(PairOperation operation, Side side, int slotId) {
        try {
            Receipt receipt = operation == PairOperation.RESERVE
                    ? services.reserve(side, slotId)
                    : services.release(side, slotId);
            log.info("{} {} succeeded: slotId={}", side.label(), operation.verb(), slotId);
            return SideResult.succeeded(receipt);
        } catch (BusinessException e) {
            log.warn("{} {} failed: slotId={}, code={}, reason={}",
                    side.label(), operation.verb(), slotId, e.getErrorCode().getCode(), e.getMessage());
            return SideResult.failed(side, e.getErrorCode(), e.getMessage());
        }
    }

    /**
     * 첫 번째 쪽 되돌리기 (예약 → 반납, 취소 → 재예약)
     */
    private PairResult compensate(int slotId, PairOperation operation, SideResult first, SideResult second) {
        Side side = first.side();
        log.warn("Rolling back {} {}: slotId={}", side.label(), operation.verb(), slotId);
        try {
            if (operation == PairOperation.RESERVE) {
                services.release(side, slotId);
            } else {
                services.reserve(side, slotId);
            }
            log.warn("Rolled back {} {}: slotId={}", side.label(), operation.verb(), slotId);
            return PairResult.of(slotId, operation, first.compensated(), second);
        } catch (BusinessException e) {
            log.error("Failed to roll back {} {}: slotId={}, code={}, reason={} - system may be inconsistent",
                    side.label(), operation.verb(), slotId, e.getErrorCode().getCode(), e.getMessage());
            return PairResult.of(slotId, operation, first, second).markInconsistent();
        }
    }

    private SideResult settled(Side side, Set<Side> requested) {
        return requested.contains(side) ? SideResult.alreadyHeld(side) : SideResult.notRequested(side);
    }
}
