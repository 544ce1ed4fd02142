package personal.pair.booking.adapter.out.external;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 슬롯 목록 응답 항목 ({"id": 3} 또는 {"id": "3"})
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlotResponse(Integer id) {
}
