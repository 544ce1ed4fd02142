package personal.pair.booking.domain.exception;

import personal.pair.booking.domain.model.Side;
import personal.pair.common.exception.ErrorCode;

/**
 * Not Processed Exception
 * 서버가 요청을 처리하지 못했을 때 발생 (404)
 */
public class NotProcessedException extends ReservationServiceException {
    public NotProcessedException(Side side, String reason) {
        super(ErrorCode.NOT_PROCESSED, side, reason);
    }
}
