package personal.pair.booking.domain.model;

import java.util.List;

/**
 * 서비스별 예약 가능 슬롯 목록 (오름차순, limit 만큼 잘림)
 */
public record AvailableSlots(
        List<Integer> hotel,
        List<Integer> band
) {
    public AvailableSlots {
        hotel = List.copyOf(hotel);
        band = List.copyOf(band);
    }
}
