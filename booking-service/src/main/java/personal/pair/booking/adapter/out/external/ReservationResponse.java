package personal.pair.booking.adapter.out.external;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 예약/반납 응답
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReservationResponse(Integer id, String message) {
}
