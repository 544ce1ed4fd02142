package personal.pair.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.pair.booking.application.port.in.QuerySlotsUseCase;
import personal.pair.booking.domain.model.AvailableSlots;
import personal.pair.booking.domain.model.BookingOutcome;
import personal.pair.booking.domain.model.HeldSlots;
import personal.pair.booking.domain.model.Side;
import personal.pair.booking.domain.service.ReservationServicePair;
import personal.pair.booking.domain.service.SlotMatcher;
import personal.pair.common.exception.BusinessException;

import java.util.List;
import java.util.Set;

/**
 * Slot Query Service
 * 보유/가용 슬롯 조회. 매 호출마다 원격 상태를 새로 읽는다 (캐시 없음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotQueryService implements QuerySlotsUseCase {

    private final ReservationServicePair services;

    @Override
    public BookingOutcome<HeldSlots> listHeld() {
        try {
            return BookingOutcome.success(services.heldSlots());
        } catch (BusinessException e) {
            log.warn("Error retrieving held slots: {}", e.getMessage());
            return BookingOutcome.failure(e, null, "list held");
        }
    }

    @Override
    public BookingOutcome<List<Integer>> candidateSlots(int limit) {
        try {
            Set<Integer> availableHotel = services.available(Side.HOTEL);
            Set<Integer> availableBand = services.available(Side.BAND);
            HeldSlots held = services.heldSlots();

            List<Integer> candidates = SlotMatcher.candidateSet(
                    availableHotel, availableBand, held.hotel(), held.band(), limit);
            log.debug("Matching candidate slots: limit={}, candidates={}", limit, candidates);
            return BookingOutcome.success(candidates);
        } catch (BusinessException e) {
            log.warn("Error retrieving matching available slots: {}", e.getMessage());
            return BookingOutcome.failure(e, null, "list candidates");
        }
    }

    @Override
    public BookingOutcome<AvailableSlots> browseAvailable(int limit) {
        try {
            List<Integer> hotel = SlotMatcher.firstN(services.available(Side.HOTEL), limit);
            List<Integer> band = SlotMatcher.firstN(services.available(Side.BAND), limit);
            return BookingOutcome.success(new AvailableSlots(hotel, band));
        } catch (BusinessException e) {
            log.warn("Error retrieving available slots: {}", e.getMessage());
            return BookingOutcome.failure(e, null, "list available");
        }
    }
}
