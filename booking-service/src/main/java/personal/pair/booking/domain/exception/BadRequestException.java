package personal.pair.booking.domain.exception;

import personal.pair.booking.domain.model.Side;
import personal.pair.common.exception.ErrorCode;

/**
 * Bad Request Exception
 * 예약 서버가 요청 형식을 거부했을 때 발생 (400)
 */
public class BadRequestException extends ReservationServiceException {
    public BadRequestException(Side side, String reason) {
        super(ErrorCode.BAD_REQUEST, side, reason);
    }
}
