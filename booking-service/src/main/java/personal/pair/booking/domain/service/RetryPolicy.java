package personal.pair.booking.domain.service;

import java.time.Duration;

/**
 * 재시도 사이 대기 시간 정책 (attempt: 1부터 시작하는 실패 횟수)
 */
public interface RetryPolicy {
    Duration nextBackoff(int attempt);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        return attempt -> backoff;
    }

    /** 선형 백오프 정책: base × attempt */
    static RetryPolicy linear(Duration base) {
        return attempt -> base.multipliedBy(Math.max(attempt, 1));
    }
}
