package personal.pair.booking.application.port.in;

import personal.pair.booking.domain.model.BookingOutcome;
import personal.pair.booking.domain.model.PairResult;

/**
 * Reserve Slot UseCase (Input Port)
 * 슬롯 예약 유스케이스
 */
public interface ReserveSlotUseCase {

    /**
     * 지정 슬롯 예약
     * 양쪽 예약 시 한쪽이 실패하면 성공한 쪽을 되돌린다
     * 이미 보유 중인 쪽은 다시 요청하지 않는다
     *
     * @param command 예약 커맨드 (slotId, side - null 이면 양쪽)
     * @return 쪽별 결과
     */
    PairResult reserve(ReserveSlotCommand command);

    /**
     * 가장 이른 짝 슬롯을 찾아 예약 (최대 재시도 횟수 내에서)
     *
     * @return Success(예약한 슬롯) | NoCandidates | Exhausted | InconsistentState
     */
    BookingOutcome<Integer> reserveEarliest();
}
