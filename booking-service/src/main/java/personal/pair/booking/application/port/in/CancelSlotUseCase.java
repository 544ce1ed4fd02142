package personal.pair.booking.application.port.in;

import personal.pair.booking.domain.model.CleanupReport;
import personal.pair.booking.domain.model.PairResult;

/**
 * Cancel Slot UseCase (Input Port)
 * 슬롯 취소 및 정리 유스케이스
 */
public interface CancelSlotUseCase {

    /**
     * 지정 슬롯 취소 (양쪽 취소 시 한쪽이 실패하면 취소한 쪽을 재예약)
     */
    PairResult cancel(CancelSlotCommand command);

    /**
     * 짝이 없는 슬롯 반납 + 가장 이른 짝 하나만 남기기
     */
    CleanupReport cancelUnmatched();

    /**
     * 보유 중인 모든 슬롯 반납
     */
    CleanupReport cancelAll();
}
