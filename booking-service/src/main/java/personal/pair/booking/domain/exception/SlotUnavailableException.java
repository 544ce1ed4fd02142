package personal.pair.booking.domain.exception;

import personal.pair.booking.domain.model.Side;
import personal.pair.common.exception.ErrorCode;

/**
 * Slot Unavailable Exception
 * 다른 클라이언트가 이미 슬롯을 선점했을 때 발생 (409)
 */
public class SlotUnavailableException extends ReservationServiceException {
    public SlotUnavailableException(Side side, String reason) {
        super(ErrorCode.SLOT_UNAVAILABLE, side, reason);
    }
}
