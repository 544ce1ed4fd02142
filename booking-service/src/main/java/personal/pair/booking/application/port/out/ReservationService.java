package personal.pair.booking.application.port.out;

import personal.pair.booking.domain.model.Receipt;
import personal.pair.booking.domain.model.Side;

import java.util.Set;

/**
 * Reservation Service (Output Port)
 * 호텔/밴드 예약 서버 하나와의 통신 인터페이스
 * 구현체: HTTP 어댑터(운영), 인메모리 어댑터(테스트/데모)
 *
 * 모든 메서드는 실패할 수 있으며
 * {@link personal.pair.booking.domain.exception.ReservationServiceException} 하위 예외를 던진다.
 * 요청 간격 제어(Rate Limit)는 호출하는 쪽의 책임
 */
public interface ReservationService {

    /**
     * 이 서비스가 담당하는 쪽 (HOTEL / BAND)
     */
    Side side();

    /**
     * 현재 예약 가능한 슬롯 목록
     */
    Set<Integer> getAvailableSlots();

    /**
     * 이 클라이언트가 보유 중인 슬롯 목록
     */
    Set<Integer> getHeldSlots();

    /**
     * 슬롯 예약
     *
     * @throws personal.pair.booking.domain.exception.SlotUnavailableException 이미 선점된 슬롯 (409)
     * @throws personal.pair.booking.domain.exception.ReservationLimitExceededException 보유 한도 초과 (451)
     * @throws personal.pair.booking.domain.exception.BadSlotException 범위를 벗어난 슬롯 (403)
     */
    Receipt reserveSlot(int slotId);

    /**
     * 슬롯 반납. 보유하지 않은 슬롯의 반납은 성공으로 처리 (멱등)
     *
     * @throws personal.pair.booking.domain.exception.BadSlotException 존재하지 않는 슬롯 (403)
     */
    Receipt releaseSlot(int slotId);
}
