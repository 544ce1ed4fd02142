package personal.pair.booking.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.pair.booking.application.port.in.CancelSlotCommand;
import personal.pair.booking.application.port.in.CancelSlotUseCase;
import personal.pair.booking.application.port.in.ReserveSlotCommand;
import personal.pair.booking.application.port.in.ReserveSlotUseCase;
import personal.pair.booking.config.BookingProperties;
import personal.pair.booking.domain.exception.ReservationServiceException;
import personal.pair.booking.domain.model.BookingOutcome;
import personal.pair.booking.domain.model.CleanupReport;
import personal.pair.booking.domain.model.HeldSlots;
import personal.pair.booking.domain.model.PairOperation;
import personal.pair.booking.domain.model.PairResult;
import personal.pair.booking.domain.model.Side;
import personal.pair.booking.domain.model.SideResult;
import personal.pair.booking.domain.service.PairBookingManager;
import personal.pair.booking.domain.service.ReservationServicePair;
import personal.pair.booking.domain.service.RetryPolicy;
import personal.pair.booking.domain.service.SlotMatcher;
import personal.pair.common.exception.BusinessException;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.OptionalInt;

/**
 * Reservation Coordinator
 * 호텔/밴드 두 서비스에 걸친 예약 조율 (단일 예약/취소, 가장 이른 짝 슬롯 찾기)
 *
 * reserveEarliest 상태 전이:
 * Attempting(n) → Success | NoCandidates | InconsistentState (종료)
 *               → Retrying(n+1)   (후보 슬롯을 다른 클라이언트가 먼저 가져간 경우 등)
 *               → Exhausted       (재시도 예산 소진)
 */
@Slf4j
@Service
public class ReservationCoordinator implements ReserveSlotUseCase, CancelSlotUseCase {

    private final PairBookingManager bookingManager;
    private final ReservationServicePair services;
    private final CleanupEngine cleanupEngine;
    private final RetryPolicy retryPolicy;
    private final BookingProperties.Saga saga;

    public ReservationCoordinator(PairBookingManager bookingManager,
                                  ReservationServicePair services,
                                  CleanupEngine cleanupEngine,
                                  RetryPolicy retryPolicy,
                                  BookingProperties properties) {
        this.bookingManager = bookingManager;
        this.services = services;
        this.cleanupEngine = cleanupEngine;
        this.retryPolicy = retryPolicy;
        this.saga = properties.saga();
    }

    @Override
    public PairResult reserve(ReserveSlotCommand command) {
        log.info("Reserving slot: slotId={}, side={}", command.slotId(),
                command.side() == null ? "both" : command.side().label());

        HeldSlots held;
        try {
            held = services.heldSlots();
        } catch (BusinessException e) {
            log.warn("Could not read held slots before reserving: slotId={}, reason={}",
                    command.slotId(), e.getMessage());
            return snapshotFailed(command.slotId(), e);
        }

        PairResult result = bookingManager.reserveMissing(command.slotId(), command.sides(), held);
        logResult(result);
        return result;
    }

    @Override
    public PairResult cancel(CancelSlotCommand command) {
        log.info("Cancelling slot: slotId={}, side={}", command.slotId(),
                command.side() == null ? "both" : command.side().label());

        PairResult result = command.side() == null
                ? bookingManager.cancelBoth(command.slotId())
                : bookingManager.cancelOne(command.slotId(), command.side());
        logResult(result);
        return result;
    }

    @Override
    public CleanupReport cancelUnmatched() {
        return cleanupEngine.cancelAllUnmatched();
    }

    @Override
    public CleanupReport cancelAll() {
        return cleanupEngine.cancelEverything();
    }

    @Override
    public BookingOutcome<Integer> reserveEarliest() {
        int attempt = 1;
        while (true) {
            Attempt result = attemptEarliest(attempt);
            if (result.outcome() != null) {
                return result.outcome();
            }

            log.warn("Failed to reserve complete matching pair: attempt={}/{}, reason={}",
                    attempt, saga.maxAttempts(), result.failure());
            if (attempt >= saga.maxAttempts()) {
                log.warn("Failed to reserve earliest slot after {} attempts", attempt);
                return BookingOutcome.exhausted(attempt, result.failure());
            }

            Duration backoff = retryPolicy.nextBackoff(attempt);
            log.info("Retrying earliest reservation: attempt={}/{}, backoff={}ms",
                    attempt + 1, saga.maxAttempts(), backoff.toMillis());
            if (!pause(backoff)) {
                return BookingOutcome.exhausted(attempt, "interrupted during backoff");
            }
            attempt++;
        }
    }

    /**
     * 한 번의 시도. 종료 결과(outcome) 또는 재시도 사유(failure) 중 하나를 돌려준다
     */
    private Attempt attemptEarliest(int attempt) {
        try {
            // 1. 현재 보유 현황
            HeldSlots held = services.heldSlots();

            // 2. 보유 한도 압박 시 짝 없는 슬롯부터 반납해서 여유 확보
            if (held.underCapacityPressure(saga.capacityThreshold())) {
                log.info("Potential reservation limit issue detected, cleaning up unmatched slots first: hotel={}, band={}",
                        held.hotel(), held.band());
                CleanupReport freed = cleanupEngine.releaseUnmatched(held);
                if (!freed.failures().isEmpty()) {
                    log.warn("Some unmatched slots could not be released: {}", freed.failures());
                }
                held = services.heldSlots();
            }

            // 3. 후보 슬롯 계산
            List<Integer> candidates = SlotMatcher.candidateSet(
                    services.available(Side.HOTEL), services.available(Side.BAND),
                    held.hotel(), held.band(), saga.candidateLimit());
            if (candidates.isEmpty()) {
                log.info("No matching slots currently available");
                return Attempt.done(BookingOutcome.noCandidates());
            }

            int target = candidates.get(0);
            log.info("Found earliest matching slot: slotId={}, attempt={}", target, attempt);

            // 4. 이미 더 이르거나 같은 짝을 보유 중이면 종료
            OptionalInt currentPair = held.earliestMatchedPair();
            if (currentPair.isPresent() && currentPair.getAsInt() <= target) {
                log.info("Already holding the earliest matching pair: slotId={}", currentPair.getAsInt());
                return Attempt.done(BookingOutcome.success(currentPair.getAsInt()));
            }

            // 5. 더 늦은 짝은 먼저 취소해서 보유 한도 확보
            if (currentPair.isPresent()) {
                int previous = currentPair.getAsInt();
                log.info("Found earlier matching slot {} than current {}, cancelling current pair", target, previous);
                PairResult cancelled = bookingManager.cancelBoth(previous);
                if (cancelled.inconsistent()) {
                    return Attempt.done(BookingOutcome.inconsistent(previous,
                            "rollback of pair cancel failed, system may be inconsistent"));
                }
                if (!cancelled.succeeded()) {
                    return Attempt.retry("cancel of pair " + previous + " failed: " + describe(cancelled));
                }
            }

            // 6. 아직 보유하지 않은 쪽만 예약 (실패 시 이번 시도에서 얻은 쪽은 manager 가 되돌림)
            PairResult reserved = bookingManager.reserveMissing(target, EnumSet.allOf(Side.class), held);
            if (reserved.inconsistent()) {
                return Attempt.done(BookingOutcome.inconsistent(target,
                        "rollback of partial reservation failed, system may be inconsistent"));
            }
            if (!reserved.succeeded()) {
                return Attempt.retry("reserve of slot " + target + " failed: " + describe(reserved));
            }

            // 7. 성공 후 뒷정리
            log.info("Successfully reserved matching pair: slotId={}", target);
            CleanupReport cleanup = cleanupEngine.cancelAllUnmatched();
            if (!cleanup.clean()) {
                log.warn("Cleanup after reservation left issues: failures={}, inconsistent={}",
                        cleanup.failures(), cleanup.inconsistent());
            }
            return Attempt.done(BookingOutcome.success(target));

        } catch (BusinessException e) {
            log.warn("Error in earliest reservation attempt {}: code={}, reason={}",
                    attempt, e.getErrorCode().getCode(), e.getMessage());
            return Attempt.retry(e.getMessage());
        }
    }

    private PairResult snapshotFailed(int slotId, BusinessException e) {
        // 스냅샷은 HOTEL 부터 읽으므로 구분할 수 없으면 HOTEL 실패로 본다
        Side side = e instanceof ReservationServiceException serviceException ? serviceException.getSide() : Side.HOTEL;
        SideResult failed = SideResult.failed(side, e.getErrorCode(), e.getMessage());
        SideResult skipped = SideResult.skipped(side.other());
        return side == Side.HOTEL
                ? PairResult.of(slotId, PairOperation.RESERVE, failed, skipped)
                : PairResult.of(slotId, PairOperation.RESERVE, skipped, failed);
    }

    private void logResult(PairResult result) {
        if (result.inconsistent()) {
            log.error("{} of slot {} left the system in a possibly inconsistent state: hotel={}, band={}",
                    result.operation().verb(), result.slotId(), result.hotel().status(), result.band().status());
        } else if (result.succeeded()) {
            log.info("{} of slot {} succeeded: hotel={}, band={}",
                    result.operation().verb(), result.slotId(), result.hotel().status(), result.band().status());
        } else {
            log.warn("{} of slot {} failed: {}", result.operation().verb(), result.slotId(), describe(result));
        }
    }

    private static String describe(PairResult result) {
        return result.firstFailure()
                .map(failure -> failure.side().label() + " " + failure.errorCode().getCode() + " " + failure.detail())
                .orElse("hotel=" + result.hotel().status() + ", band=" + result.band().status());
    }

    private static boolean pause(Duration backoff) {
        if (backoff.isZero() || backoff.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(backoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during retry backoff");
            return false;
        }
    }

    private record Attempt(BookingOutcome<Integer> outcome, String failure) {
        static Attempt done(BookingOutcome<Integer> outcome) {
            return new Attempt(outcome, null);
        }

        static Attempt retry(String failure) {
            return new Attempt(null, failure);
        }
    }
}
