package personal.pair.booking.domain.model;

import java.util.List;
import java.util.OptionalInt;

/**
 * Cleanup Report
 * 정리 작업 결과 요약. 개별 실패는 중단 없이 failures 에 모아서 보고
 */
public record CleanupReport(
        List<Integer> releasedHotel,
        List<Integer> releasedBand,
        List<Integer> cancelledPairs,
        Integer keptPair,
        List<SlotFailure> failures,
        boolean inconsistent
) {
    public CleanupReport {
        releasedHotel = List.copyOf(releasedHotel);
        releasedBand = List.copyOf(releasedBand);
        cancelledPairs = List.copyOf(cancelledPairs);
        failures = List.copyOf(failures);
    }

    public static CleanupReport failed(SlotFailure failure) {
        return new CleanupReport(List.of(), List.of(), List.of(), null, List.of(failure), false);
    }

    public boolean clean() {
        return failures.isEmpty() && !inconsistent;
    }

    public OptionalInt kept() {
        return keptPair == null ? OptionalInt.empty() : OptionalInt.of(keptPair);
    }

    public List<Integer> released(Side side) {
        return side == Side.HOTEL ? releasedHotel : releasedBand;
    }
}
