package personal.pair.booking.adapter.out.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import personal.pair.booking.application.port.out.ReservationService;
import personal.pair.booking.config.BookingProperties;
import personal.pair.booking.domain.model.Side;

/**
 * In-Memory Adapter Configuration
 * booking.mode=in-memory 또는 설정이 없는 경우 (기본값) 인메모리 서비스 사용
 *
 * 주의: 실제 예약 서버와 통신하지 않음. 로컬 데모/테스트 전용
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "booking.mode", havingValue = BookingProperties.MODE_IN_MEMORY, matchIfMissing = true)
public class InMemoryAdapterConfig {

    @Bean
    public ReservationService hotelReservationService(BookingProperties properties) {
        return create(Side.HOTEL, properties.inMemory(), 0);
    }

    @Bean
    public ReservationService bandReservationService(BookingProperties properties) {
        return create(Side.BAND, properties.inMemory(), 1);
    }

    private InMemoryReservationService create(Side side, BookingProperties.InMemory settings, long seedOffset) {
        log.info("Creating in-memory {} reservation service - no remote server will be used", side.label());
        return InMemoryReservationService.withRandomTaken(
                side,
                settings.slotCount(),
                settings.holdLimit(),
                settings.takenRatio(),
                settings.seed() + seedOffset);
    }
}
