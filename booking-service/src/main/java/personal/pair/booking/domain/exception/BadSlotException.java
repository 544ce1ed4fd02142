package personal.pair.booking.domain.exception;

import personal.pair.booking.domain.model.Side;
import personal.pair.common.exception.ErrorCode;

/**
 * Bad Slot Exception
 * 존재하지 않는 슬롯 번호일 때 발생 (403)
 */
public class BadSlotException extends ReservationServiceException {
    public BadSlotException(Side side, String reason) {
        super(ErrorCode.BAD_SLOT, side, reason);
    }
}
