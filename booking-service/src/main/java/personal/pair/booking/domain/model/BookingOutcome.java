package personal.pair.booking.domain.model;

import personal.pair.booking.domain.exception.ReservationServiceException;
import personal.pair.common.exception.BusinessException;
import personal.pair.common.exception.ErrorCode;

import java.util.Optional;

/**
 * Booking Outcome
 * 조율 작업의 결과 타입. 예외 대신 결과로 성공/실패를 구분
 *
 * - Success: 정상 완료 (payload 포함)
 * - NoCandidates: 예약 가능한 짝 슬롯이 없음 (에러가 아닌 정상 종료)
 * - ServiceFailure: 원격 서비스 실패 (어느 쪽, 어떤 작업인지 포함)
 * - InconsistentState: 보상 작업 실패로 상태가 어긋났을 수 있음
 * - Exhausted: 재시도 예산을 모두 소진
 */
public sealed interface BookingOutcome<T> {

    record Success<T>(T value) implements BookingOutcome<T> {
    }

    record NoCandidates<T>() implements BookingOutcome<T> {
    }

    record ServiceFailure<T>(
            ErrorCode errorCode,
            Side side,
            Integer slotId,
            String operation,
            String detail
    ) implements BookingOutcome<T> {
    }

    record InconsistentState<T>(int slotId, String detail) implements BookingOutcome<T> {
    }

    record Exhausted<T>(int attempts, String lastFailure) implements BookingOutcome<T> {
    }

    static <T> BookingOutcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> BookingOutcome<T> noCandidates() {
        return new NoCandidates<>();
    }

    static <T> BookingOutcome<T> failure(ErrorCode errorCode, Side side, Integer slotId,
                                         String operation, String detail) {
        return new ServiceFailure<>(errorCode, side, slotId, operation, detail);
    }

    /**
     * 원격 호출 예외를 ServiceFailure 로 변환 (어느 쪽에서 실패했는지 예외에서 꺼냄)
     */
    static <T> BookingOutcome<T> failure(BusinessException e, Integer slotId, String operation) {
        Side side = e instanceof ReservationServiceException serviceException ? serviceException.getSide() : null;
        return new ServiceFailure<>(e.getErrorCode(), side, slotId, operation, e.getMessage());
    }

    static <T> BookingOutcome<T> inconsistent(int slotId, String detail) {
        return new InconsistentState<>(slotId, detail);
    }

    static <T> BookingOutcome<T> exhausted(int attempts, String lastFailure) {
        return new Exhausted<>(attempts, lastFailure);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default Optional<T> toOptional() {
        if (this instanceof Success<T> success) {
            return Optional.ofNullable(success.value());
        }
        return Optional.empty();
    }

    default T orElse(T other) {
        return toOptional().orElse(other);
    }
}
