package personal.pair.booking.domain.model;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Pair Result
 * 양쪽 서비스에 대한 예약/취소 결과 (부분 성공 여부까지 포함)
 *
 * inconsistent: 보상 작업 자체가 실패하여 한쪽만 남았을 수 있는 상태.
 * 일반 실패와 구분해서 호출자에게 노출해야 함
 */
public record PairResult(
        int slotId,
        PairOperation operation,
        SideResult hotel,
        SideResult band,
        boolean inconsistent
) {
    public static PairResult of(int slotId, PairOperation operation, SideResult hotel, SideResult band) {
        return new PairResult(slotId, operation, hotel, band, false);
    }

    public SideResult get(Side side) {
        return side == Side.HOTEL ? hotel : band;
    }

    /**
     * 요청한 모든 쪽이 성공(또는 이미 보유)했는지
     */
    public boolean succeeded() {
        return !inconsistent && hotel.status().isSatisfied() && band.status().isSatisfied();
    }

    public Optional<SideResult> firstFailure() {
        return Stream.of(hotel, band)
                .filter(SideResult::isFailed)
                .findFirst();
    }

    public PairResult markInconsistent() {
        return new PairResult(slotId, operation, hotel, band, true);
    }
}
