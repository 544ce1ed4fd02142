package personal.pair.booking.domain.model;

/**
 * 예약 서버의 성공 응답
 */
public record Receipt(
        Side side,
        int slotId,
        String message
) {
}
