package personal.pair.booking.application.port.in;

import personal.pair.booking.domain.model.AvailableSlots;
import personal.pair.booking.domain.model.BookingOutcome;
import personal.pair.booking.domain.model.HeldSlots;

import java.util.List;

/**
 * Query Slots UseCase (Input Port)
 * 보유/가용 슬롯 조회 유스케이스. 조회 실패도 예외 대신 ServiceFailure 로 반환
 */
public interface QuerySlotsUseCase {

    /**
     * 양쪽 보유 슬롯 조회
     */
    BookingOutcome<HeldSlots> listHeld();

    /**
     * 짝 예약이 가능한 후보 슬롯 (오름차순 앞에서 limit 개)
     */
    BookingOutcome<List<Integer>> candidateSlots(int limit);

    /**
     * 서비스별 예약 가능 슬롯 (오름차순 앞에서 limit 개)
     */
    BookingOutcome<AvailableSlots> browseAvailable(int limit);
}
