package personal.pair.booking.domain.exception;

import personal.pair.booking.domain.model.Side;
import personal.pair.common.exception.ErrorCode;

/**
 * Reservation Service Unavailable Exception
 * 5xx, 연결 실패, Timeout 이 재시도 후에도 계속될 때 발생
 */
public class ReservationServiceUnavailableException extends ReservationServiceException {
    public ReservationServiceUnavailableException(Side side, String reason) {
        super(ErrorCode.RESERVATION_SERVICE_UNAVAILABLE, side, reason);
    }

    public ReservationServiceUnavailableException(Side side, String reason, Throwable cause) {
        super(ErrorCode.RESERVATION_SERVICE_UNAVAILABLE, side, reason, cause);
    }
}
