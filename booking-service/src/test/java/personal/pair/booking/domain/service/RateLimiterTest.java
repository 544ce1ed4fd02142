package personal.pair.booking.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.pair.common.exception.BusinessException;
import personal.pair.common.exception.ErrorCode;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Rate Limiter 단위 테스트
 * 실제 시간을 사용하므로 간격은 짧게 (100ms) 잡고, 하한만 검증한다
 */
@DisplayName("RateLimiter 단위 테스트")
class RateLimiterTest {

    private static final Duration INTERVAL = Duration.ofMillis(100);

    @Test
    @DisplayName("첫 요청은 대기 없이 통과")
    void firstAcquire_NoWait() {
        // given
        RateLimiter rateLimiter = new RateLimiter(Duration.ofSeconds(5));

        // when
        long start = System.nanoTime();
        rateLimiter.acquire();
        long elapsed = System.nanoTime() - start;

        // then
        assertThat(Duration.ofNanos(elapsed)).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("연속 요청 사이에 최소 간격 보장")
    void consecutiveAcquire_WaitsMinInterval() {
        // given
        RateLimiter rateLimiter = new RateLimiter(INTERVAL);

        // when
        long start = System.nanoTime();
        for (int i = 0; i < 3; i++) {
            rateLimiter.acquire();
        }
        long elapsed = System.nanoTime() - start;

        // then
        assertThat(elapsed).isGreaterThanOrEqualTo(INTERVAL.multipliedBy(2).toNanos());
    }

    @Test
    @DisplayName("이미 간격이 지났으면 남은 시간만큼만 대기 (추가 대기 없음)")
    void acquireAfterInterval_NoExtraWait() throws InterruptedException {
        // given
        RateLimiter rateLimiter = new RateLimiter(INTERVAL);
        rateLimiter.acquire();
        Thread.sleep(INTERVAL.toMillis() + 50);

        // when
        long start = System.nanoTime();
        rateLimiter.acquire();
        long elapsed = System.nanoTime() - start;

        // then
        assertThat(Duration.ofNanos(elapsed)).isLessThan(INTERVAL);
    }

    @Test
    @DisplayName("여러 스레드가 동시에 호출해도 간격이 깨지지 않음")
    void concurrentAcquire_KeepsSpacing() {
        // given
        RateLimiter rateLimiter = new RateLimiter(Duration.ofMillis(50));
        int threadCount = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        AtomicInteger acquired = new AtomicInteger();

        // when
        long start = System.nanoTime();
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                rateLimiter.acquire();
                acquired.incrementAndGet();
            });
        }
        await().atMost(Duration.ofSeconds(5))
                .until(acquired::get, count -> count == threadCount);
        long elapsed = System.nanoTime() - start;
        executor.shutdown();

        // then: 4번의 요청 사이 간격 3개
        assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(50).multipliedBy(threadCount - 1).toNanos());
    }

    @Test
    @DisplayName("대기 중 인터럽트되면 인터럽트 플래그를 복원하고 예외")
    void acquire_Interrupted() {
        // given
        RateLimiter rateLimiter = new RateLimiter(Duration.ofSeconds(10));
        rateLimiter.acquire();
        Thread.currentThread().interrupt();

        try {
            // when & then
            assertThatThrownBy(rateLimiter::acquire)
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                            .isEqualTo(ErrorCode.INTERNAL_SERVER_ERROR));
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("음수 간격은 거부")
    void negativeInterval_Rejected() {
        assertThatThrownBy(() -> new RateLimiter(Duration.ofMillis(-1)))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("must not be negative");
    }

    @Test
    @DisplayName("간격 0 이면 대기 없음")
    void zeroInterval_NoWait() {
        // given
        RateLimiter rateLimiter = new RateLimiter(Duration.ZERO);

        // when
        long start = System.nanoTime();
        for (int i = 0; i < 100; i++) {
            rateLimiter.acquire();
        }

        // then
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
        assertThat(rateLimiter.minInterval()).isEqualTo(Duration.ZERO);
    }
}
