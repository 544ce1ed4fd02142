package personal.pair.booking.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Booking 설정 Properties
 * application.yml 의 booking.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "booking")
public record BookingProperties(
        String mode,
        Services services,
        Transport transport,
        RateLimit rateLimit,
        Saga saga,
        Browse browse,
        InMemory inMemory,
        Demo demo
) {
    public static final String MODE_HTTP = "http";
    public static final String MODE_IN_MEMORY = "in-memory";

    public record Services(
            Endpoint hotel,
            Endpoint band
    ) {}

    public record Endpoint(
            String baseUrl,
            String token
    ) {}

    public record Transport(
            int maxAttempts,        // 5xx, 연결 실패 시 최대 시도 횟수
            Duration delay,         // 재시도 사이 대기
            Duration connectTimeout,
            Duration readTimeout
    ) {}

    public record RateLimit(
            Duration minInterval    // 전체 원격 요청 최소 간격
    ) {}

    public record Saga(
            int maxAttempts,        // reserveEarliest 재시도 예산
            Duration backoff,       // 선형 백오프 기준 (backoff × attempt)
            int capacityThreshold,  // 한쪽 보유 수가 이 이상이면 미매칭 슬롯부터 정리
            int candidateLimit
    ) {}

    public record Browse(
            int limit
    ) {}

    public record InMemory(
            int slotCount,
            int holdLimit,
            double takenRatio,      // 다른 클라이언트가 선점한 슬롯 비율
            long seed
    ) {}

    public record Demo(
            boolean enabled
    ) {}
}
