package personal.pair.booking.domain.model;

import personal.pair.common.exception.ErrorCode;

/**
 * Side Result
 * 한쪽 서비스에 대한 예약/취소 결과
 * 실패 시 errorCode, detail 에 원인이 담김
 */
public record SideResult(
        Side side,
        SideStatus status,
        Receipt receipt,
        ErrorCode errorCode,
        String detail
) {
    public static SideResult succeeded(Receipt receipt) {
        return new SideResult(receipt.side(), SideStatus.SUCCEEDED, receipt, null, null);
    }

    public static SideResult alreadyHeld(Side side) {
        return new SideResult(side, SideStatus.ALREADY_HELD, null, null, null);
    }

    public static SideResult notRequested(Side side) {
        return new SideResult(side, SideStatus.NOT_REQUESTED, null, null, null);
    }

    public static SideResult skipped(Side side) {
        return new SideResult(side, SideStatus.SKIPPED, null, null, null);
    }

    public static SideResult failed(Side side, ErrorCode errorCode, String detail) {
        return new SideResult(side, SideStatus.FAILED, null, errorCode, detail);
    }

    public SideResult compensated() {
        return new SideResult(side, SideStatus.COMPENSATED, receipt, errorCode, detail);
    }

    public boolean isSucceeded() {
        return status == SideStatus.SUCCEEDED;
    }

    public boolean isFailed() {
        return status == SideStatus.FAILED;
    }
}
