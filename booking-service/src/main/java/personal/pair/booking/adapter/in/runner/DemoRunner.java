package personal.pair.booking.adapter.in.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import personal.pair.booking.application.port.in.CancelSlotUseCase;
import personal.pair.booking.application.port.in.QuerySlotsUseCase;
import personal.pair.booking.application.port.in.ReserveSlotUseCase;
import personal.pair.booking.config.BookingProperties;
import personal.pair.booking.domain.model.AvailableSlots;
import personal.pair.booking.domain.model.BookingOutcome;
import personal.pair.booking.domain.model.CleanupReport;
import personal.pair.booking.domain.model.HeldSlots;

/**
 * Demo Runner
 * booking.demo.enabled=true 일 때 애플리케이션 시작 후 전체 흐름을 한 번 실행
 * 조회 → 가장 이른 짝 예약 → 보유 확인 → 전체 취소 → 취소 확인
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "booking.demo.enabled", havingValue = "true")
public class DemoRunner implements ApplicationRunner {

    private final QuerySlotsUseCase querySlotsUseCase;
    private final ReserveSlotUseCase reserveSlotUseCase;
    private final CancelSlotUseCase cancelSlotUseCase;
    private final BookingProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Starting demo (mode={})", properties.mode());

        log.info("1. View available slots");
        BookingOutcome<AvailableSlots> available = querySlotsUseCase.browseAvailable(properties.browse().limit());
        available.toOptional().ifPresentOrElse(
                slots -> log.info("Hotel: {}, Band: {}", slots.hotel(), slots.band()),
                () -> log.warn("Could not list available slots: {}", available));

        log.info("2. Reserve earliest matching slot");
        BookingOutcome<Integer> reserved = reserveSlotUseCase.reserveEarliest();
        log.info("Reservation result: {}", reserved);

        log.info("3. View held slots");
        logHeld(querySlotsUseCase.listHeld());

        log.info("4. Cancel all reservations");
        CleanupReport report = cancelSlotUseCase.cancelAll();
        log.info("Cancelled: hotel={}, band={}, failures={}",
                report.releasedHotel(), report.releasedBand(), report.failures());

        log.info("5. Verify cancellation");
        logHeld(querySlotsUseCase.listHeld());

        log.info("Demo completed");
    }

    private void logHeld(BookingOutcome<HeldSlots> held) {
        held.toOptional().ifPresentOrElse(
                slots -> log.info("Held hotel: {}, held band: {}", slots.hotel(), slots.band()),
                () -> log.warn("Could not list held slots: {}", held));
    }
}
