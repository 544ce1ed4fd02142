package personal.pair.booking.domain.service;

import lombok.extern.slf4j.Slf4j;
import personal.pair.booking.application.port.out.ReservationService;
import personal.pair.booking.domain.model.HeldSlots;
import personal.pair.booking.domain.model.Receipt;
import personal.pair.booking.domain.model.Side;

import java.util.Set;

/**
 * Reservation Service Pair
 * 호텔/밴드 서비스 한 쌍과 공유 Rate Limiter 를 묶은 호출 창구
 * 모든 원격 호출 직전에 rateLimiter.acquire() 를 거친다
 *
 * 예외는 그대로 전파하므로 잡는 쪽(PairBookingManager 등)에서 결과로 변환해야 함
 */
@Slf4j
public class ReservationServicePair {

    private final ReservationService hotel;
    private final ReservationService band;
    private final RateLimiter rateLimiter;

    public ReservationServicePair(ReservationService hotel, ReservationService band, RateLimiter rateLimiter) {
        if (hotel.side() != Side.HOTEL || band.side() != Side.BAND) {
            throw new IllegalArgumentException(
                    "Services are wired to the wrong sides: hotel=" + hotel.side() + ", band=" + band.side());
        }
        this.hotel = hotel;
        this.band = band;
        this.rateLimiter = rateLimiter;
    }

    public ReservationService service(Side side) {
        return side == Side.HOTEL ? hotel : band;
    }

    public Set<Integer> available(Side side) {
        rateLimiter.acquire();
        return service(side).getAvailableSlots();
    }

    public Set<Integer> held(Side side) {
        rateLimiter.acquire();
        return service(side).getHeldSlots();
    }

    /**
     * 양쪽 보유 슬롯 스냅샷 (HOTEL → BAND 순서로 조회)
     */
    public HeldSlots heldSlots() {
        Set<Integer> heldHotel = held(Side.HOTEL);
        Set<Integer> heldBand = held(Side.BAND);
        log.debug("Held slots snapshot: hotel={}, band={}", heldHotel, heldBand);
        return HeldSlots.of(heldHotel, heldBand);
    }

    public Receipt reserve(Side side, int slotId) {
        rateLimiter.acquire();
        return service(side).reserveSlot(slotId);
    }

    public Receipt release(Side side, int slotId) {
        rateLimiter.acquire();
        return service(side).releaseSlot(slotId);
    }
}
