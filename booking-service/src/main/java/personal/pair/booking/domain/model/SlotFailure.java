package personal.pair.booking.domain.model;

import personal.pair.booking.domain.exception.ReservationServiceException;
import personal.pair.common.exception.BusinessException;
import personal.pair.common.exception.ErrorCode;

/**
 * 일괄 정리 작업 중 개별 슬롯 실패 기록
 */
public record SlotFailure(
        Side side,
        Integer slotId,
        String operation,
        ErrorCode errorCode,
        String detail
) {
    public static SlotFailure from(BusinessException e, Side side, Integer slotId, String operation) {
        Side failedSide = e instanceof ReservationServiceException serviceException ? serviceException.getSide() : side;
        return new SlotFailure(failedSide, slotId, operation, e.getErrorCode(), e.getMessage());
    }

    @Override
    public String toString() {
        String target = side == null ? "both" : side.label();
        return String.format("%s %s slot=%s [%s] %s",
                operation, target, slotId, errorCode == null ? "-" : errorCode.getCode(), detail);
    }
}
