package personal.pair.booking.domain.exception;

import personal.pair.booking.domain.model.Side;
import personal.pair.common.exception.ErrorCode;

/**
 * Invalid Token Exception
 * API 토큰이 유효하지 않을 때 발생 (401)
 */
public class InvalidTokenException extends ReservationServiceException {
    public InvalidTokenException(Side side, String reason) {
        super(ErrorCode.INVALID_TOKEN, side, reason);
    }
}
