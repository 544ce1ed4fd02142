package personal.pair.booking.domain.exception;

import personal.pair.booking.domain.model.Side;
import personal.pair.common.exception.ErrorCode;

/**
 * Reservation Limit Exceeded Exception
 * 클라이언트당 최대 보유 슬롯 수를 초과했을 때 발생 (451)
 */
public class ReservationLimitExceededException extends ReservationServiceException {
    public ReservationLimitExceededException(Side side, String reason) {
        super(ErrorCode.RESERVATION_LIMIT_EXCEEDED, side, reason);
    }
}
