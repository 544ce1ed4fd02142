package personal.pair.booking.domain.service;

import lombok.extern.slf4j.Slf4j;
import personal.pair.common.exception.BusinessException;
import personal.pair.common.exception.ErrorCode;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rate Limiter
 * 호텔/밴드 구분 없이 프로세스 전체의 원격 요청을 최소 간격 이상으로 벌려놓는다 (기본 1초)
 *
 * 동작:
 * - 남은 대기 시간 = max(0, minInterval - 마지막 요청 이후 경과 시간)
 * - 매번 1초를 통째로 자지 않으므로 불필요하게 오래 기다리지 않음
 * - 읽기 → 계산 → 대기 → 갱신 전체를 하나의 락으로 감싸서
 *   두 스레드가 동시에 깨어나 간격을 깨뜨리는 상황 방지
 */
@Slf4j
public class RateLimiter {

    private final long minIntervalNanos;
    private final ReentrantLock lock = new ReentrantLock(true);

    private long lastRequestNanos;
    private boolean hasPreviousRequest;

    public RateLimiter(Duration minInterval) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Rate limit interval must not be negative");
        }
        this.minIntervalNanos = minInterval.toNanos();
    }

    /**
     * 직전 요청 이후 최소 간격이 지날 때까지 대기
     */
    public void acquire() {
        lock.lock();
        try {
            if (hasPreviousRequest) {
                long remaining = minIntervalNanos - (System.nanoTime() - lastRequestNanos);
                if (remaining > 0) {
                    log.debug("Rate limit wait: {}ms", TimeUnit.NANOSECONDS.toMillis(remaining));
                }
                // Thread.sleep 은 나노초 단위에서 조금 일찍 깰 수 있으므로 남은 시간이 없을 때까지 반복
                while (remaining > 0) {
                    TimeUnit.NANOSECONDS.sleep(remaining);
                    remaining = minIntervalNanos - (System.nanoTime() - lastRequestNanos);
                }
            }
            lastRequestNanos = System.nanoTime();
            hasPreviousRequest = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR,
                    "Interrupted while waiting for rate limit", e);
        } finally {
            lock.unlock();
        }
    }

    public Duration minInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
