package personal.pair.booking.adapter.out.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import personal.pair.booking.application.port.out.ReservationService;
import personal.pair.booking.config.BookingProperties;
import personal.pair.booking.domain.exception.ReservationServiceUnavailableException;
import personal.pair.booking.domain.model.Side;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Reservation API Client Configuration
 * booking.mode=http 일 때 호텔/밴드 서버용 RestClient 어댑터를 생성
 *
 * Timeout/Retry 는 booking.transport.* 설정을 따름
 * - Retry 대상: 5xx, 연결 실패, Timeout (ReservationServiceUnavailableException)
 * - 4xx 는 재시도해도 결과가 같으므로 즉시 실패
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "booking.mode", havingValue = BookingProperties.MODE_HTTP)
public class ReservationApiClientConfig {

    @Bean
    public ReservationService hotelReservationService(BookingProperties properties, ObjectMapper objectMapper) {
        return createAdapter(Side.HOTEL, properties.services().hotel(), properties.transport(), objectMapper);
    }

    @Bean
    public ReservationService bandReservationService(BookingProperties properties, ObjectMapper objectMapper) {
        return createAdapter(Side.BAND, properties.services().band(), properties.transport(), objectMapper);
    }

    static ReservationApiRestClientAdapter createAdapter(Side side,
                                                         BookingProperties.Endpoint endpoint,
                                                         BookingProperties.Transport transport,
                                                         ObjectMapper objectMapper) {
        log.info("Creating {} reservation client: baseUrl={}, maxAttempts={}, delay={}ms",
                side.label(), endpoint.baseUrl(), transport.maxAttempts(), transport.delay().toMillis());
        return new ReservationApiRestClientAdapter(
                side,
                restClient(endpoint.baseUrl(), transport),
                endpoint.token(),
                retry(side, transport),
                objectMapper);
    }

    static RestClient restClient(String baseUrl, BookingProperties.Transport transport) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(transport.connectTimeout())
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(transport.readTimeout());

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }

    static Retry retry(Side side, BookingProperties.Transport transport) {
        // Resilience4j 는 1ms 미만 대기를 허용하지 않음
        Duration wait = transport.delay().toMillis() < 1 ? Duration.ofMillis(1) : transport.delay();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(transport.maxAttempts(), 1))
                .waitDuration(wait)
                .retryExceptions(ReservationServiceUnavailableException.class)
                .build();
        return Retry.of("reservation-" + side.label(), config);
    }
}
