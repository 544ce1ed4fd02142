package personal.pair.booking.application.port.in;

import personal.pair.booking.domain.model.Side;
import personal.pair.common.exception.BusinessException;
import personal.pair.common.exception.ErrorCode;

/**
 * Cancel Slot Command
 * 슬롯 취소 커맨드 (side 가 null 이면 양쪽 모두)
 */
public record CancelSlotCommand(
        int slotId,
        Side side
) {
    public CancelSlotCommand {
        if (slotId <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot ID must be positive: " + slotId);
        }
    }

    public static CancelSlotCommand both(int slotId) {
        return new CancelSlotCommand(slotId, null);
    }
}
