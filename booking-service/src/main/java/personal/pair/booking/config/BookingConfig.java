package personal.pair.booking.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import personal.pair.booking.application.port.out.ReservationService;
import personal.pair.booking.domain.model.Side;
import personal.pair.booking.domain.service.RateLimiter;
import personal.pair.booking.domain.service.ReservationServicePair;
import personal.pair.booking.domain.service.RetryPolicy;

import java.util.List;

/**
 * Booking Configuration
 * Rate Limiter 는 프로세스에 하나만 두고 호텔/밴드 호출이 함께 공유
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(BookingProperties.class)
public class BookingConfig {

    @Bean
    public RateLimiter rateLimiter(BookingProperties properties) {
        log.info("Rate limiter interval: {}ms", properties.rateLimit().minInterval().toMillis());
        return new RateLimiter(properties.rateLimit().minInterval());
    }

    @Bean
    public RetryPolicy earliestReservationRetryPolicy(BookingProperties properties) {
        return RetryPolicy.linear(properties.saga().backoff());
    }

    @Bean
    public ReservationServicePair reservationServicePair(List<ReservationService> services, RateLimiter rateLimiter) {
        return new ReservationServicePair(find(services, Side.HOTEL), find(services, Side.BAND), rateLimiter);
    }

    private ReservationService find(List<ReservationService> services, Side side) {
        return services.stream()
                .filter(service -> service.side() == side)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No reservation service configured for " + side.label()));
    }
}
