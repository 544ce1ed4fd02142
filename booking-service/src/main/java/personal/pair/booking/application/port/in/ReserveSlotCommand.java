package personal.pair.booking.application.port.in;

import personal.pair.booking.domain.model.Side;
import personal.pair.common.exception.BusinessException;
import personal.pair.common.exception.ErrorCode;

import java.util.EnumSet;
import java.util.Set;

/**
 * Reserve Slot Command
 * 슬롯 예약 커맨드 (side 가 null 이면 양쪽 모두)
 */
public record ReserveSlotCommand(
        int slotId,
        Side side
) {
    public ReserveSlotCommand {
        if (slotId <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot ID must be positive: " + slotId);
        }
    }

    public static ReserveSlotCommand both(int slotId) {
        return new ReserveSlotCommand(slotId, null);
    }

    public Set<Side> sides() {
        return side == null ? EnumSet.allOf(Side.class) : EnumSet.of(side);
    }
}
