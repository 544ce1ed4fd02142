package personal.pair.booking.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.pair.booking.adapter.out.memory.InMemoryReservationService;
import personal.pair.booking.domain.exception.ReservationServiceUnavailableException;
import personal.pair.booking.domain.model.CleanupReport;
import personal.pair.booking.domain.model.Receipt;
import personal.pair.booking.domain.model.Side;
import personal.pair.booking.domain.service.PairBookingManager;
import personal.pair.booking.domain.service.RateLimiter;
import personal.pair.booking.domain.service.ReservationServicePair;
import personal.pair.common.exception.ErrorCode;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Cleanup Engine 테스트 (인메모리 서비스 사용)
 */
@DisplayName("CleanupEngine 테스트")
class CleanupEngineTest {

    private InMemoryReservationService hotel;
    private InMemoryReservationService band;
    private CleanupEngine cleanupEngine;

    @BeforeEach
    void setUp() {
        hotel = new InMemoryReservationService(Side.HOTEL, 10, 5, List.of());
        band = new InMemoryReservationService(Side.BAND, 10, 5, List.of());
        wire(hotel, band);
    }

    private void wire(InMemoryReservationService hotelService, InMemoryReservationService bandService) {
        ReservationServicePair services = new ReservationServicePair(
                hotelService, bandService, new RateLimiter(Duration.ZERO));
        cleanupEngine = new CleanupEngine(services, new PairBookingManager(services));
    }

    @Test
    @DisplayName("짝 없는 슬롯만 반납하고 짝은 유지")
    void cancelAllUnmatched_ReleasesUnmatchedOnly() {
        // given: hotel={2,5}, band={5}
        hotel.holdDirectly(2);
        hotel.holdDirectly(5);
        band.holdDirectly(5);

        // when
        CleanupReport report = cleanupEngine.cancelAllUnmatched();

        // then
        assertThat(report.clean()).isTrue();
        assertThat(report.releasedHotel()).containsExactly(2);
        assertThat(report.releasedBand()).isEmpty();
        assertThat(report.kept()).hasValue(5);
        assertThat(hotel.getHeldSlots()).containsExactly(5);
        assertThat(band.getHeldSlots()).containsExactly(5);
    }

    @Test
    @DisplayName("짝이 여러 개면 가장 이른 것만 남김")
    void cancelAllUnmatched_KeepsEarliestPair() {
        // given
        for (int slotId : List.of(3, 6, 9)) {
            hotel.holdDirectly(slotId);
            band.holdDirectly(slotId);
        }
        band.holdDirectly(1);

        // when
        CleanupReport report = cleanupEngine.cancelAllUnmatched();

        // then
        assertThat(report.cancelledPairs()).containsExactly(6, 9);
        assertThat(report.releasedBand()).containsExactly(1);
        assertThat(report.kept()).hasValue(3);
        assertThat(hotel.getHeldSlots()).containsExactly(3);
        assertThat(band.getHeldSlots()).containsExactly(3);
    }

    @Test
    @DisplayName("보유 슬롯이 없으면 아무것도 하지 않음")
    void cancelAllUnmatched_Empty() {
        // when
        CleanupReport report = cleanupEngine.cancelAllUnmatched();

        // then
        assertThat(report.clean()).isTrue();
        assertThat(report.kept()).isEmpty();
        assertThat(report.releasedHotel()).isEmpty();
        assertThat(report.cancelledPairs()).isEmpty();
    }

    @Test
    @DisplayName("개별 슬롯 반납 실패는 모아서 보고하고 나머지는 계속 진행")
    void cancelAllUnmatched_CollectsFailures() {
        // given: hotel 슬롯 4 반납만 실패
        InMemoryReservationService flakyHotel = new InMemoryReservationService(Side.HOTEL, 10, 5, List.of()) {
            @Override
            public synchronized Receipt releaseSlot(int slotId) {
                if (slotId == 4) {
                    throw new ReservationServiceUnavailableException(Side.HOTEL, "Server error 503: unavailable");
                }
                return super.releaseSlot(slotId);
            }
        };
        flakyHotel.holdDirectly(4);
        flakyHotel.holdDirectly(8);
        wire(flakyHotel, band);

        // when
        CleanupReport report = cleanupEngine.cancelAllUnmatched();

        // then
        assertThat(report.clean()).isFalse();
        assertThat(report.releasedHotel()).containsExactly(8);
        assertThat(report.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.side()).isEqualTo(Side.HOTEL);
            assertThat(failure.slotId()).isEqualTo(4);
            assertThat(failure.errorCode()).isEqualTo(ErrorCode.RESERVATION_SERVICE_UNAVAILABLE);
        });
        assertThat(flakyHotel.getHeldSlots()).containsExactly(4);
    }

    @Test
    @DisplayName("짝이 하나뿐이면 슬롯 ID 가 최댓값이어도 그대로 유지")
    void cancelAllUnmatched_KeepsSinglePairAtMaxSlotId() {
        // given
        int lastSlot = Integer.MAX_VALUE;
        InMemoryReservationService wideHotel = new InMemoryReservationService(Side.HOTEL, lastSlot, 5, List.of());
        InMemoryReservationService wideBand = new InMemoryReservationService(Side.BAND, lastSlot, 5, List.of());
        wideHotel.holdDirectly(lastSlot);
        wideBand.holdDirectly(lastSlot);
        wire(wideHotel, wideBand);

        // when
        CleanupReport report = cleanupEngine.cancelAllUnmatched();

        // then
        assertThat(report.clean()).isTrue();
        assertThat(report.kept()).hasValue(lastSlot);
        assertThat(report.cancelledPairs()).isEmpty();
        assertThat(wideHotel.getHeldSlots()).containsExactly(lastSlot);
        assertThat(wideBand.getHeldSlots()).containsExactly(lastSlot);
    }

    @Test
    @DisplayName("전체 취소 - 양쪽 보유 슬롯 모두 반납")
    void cancelEverything() {
        // given
        hotel.holdDirectly(2);
        hotel.holdDirectly(5);
        band.holdDirectly(5);

        // when
        CleanupReport report = cleanupEngine.cancelEverything();

        // then
        assertThat(report.clean()).isTrue();
        assertThat(report.releasedHotel()).containsExactly(2, 5);
        assertThat(report.releasedBand()).containsExactly(5);
        assertThat(hotel.getHeldSlots()).isEmpty();
        assertThat(band.getHeldSlots()).isEmpty();
    }

    @Test
    @DisplayName("전체 취소 중 개별 슬롯 실패는 모아서 보고하고 나머지는 계속 반납")
    void cancelEverything_CollectsFailures() {
        // given: hotel 슬롯 4 반납만 실패
        InMemoryReservationService flakyHotel = new InMemoryReservationService(Side.HOTEL, 10, 5, List.of()) {
            @Override
            public synchronized Receipt releaseSlot(int slotId) {
                if (slotId == 4) {
                    throw new ReservationServiceUnavailableException(Side.HOTEL, "Server error 503: unavailable");
                }
                return super.releaseSlot(slotId);
            }
        };
        flakyHotel.holdDirectly(4);
        flakyHotel.holdDirectly(8);
        band.holdDirectly(4);
        wire(flakyHotel, band);

        // when
        CleanupReport report = cleanupEngine.cancelEverything();

        // then
        assertThat(report.clean()).isFalse();
        assertThat(report.releasedHotel()).containsExactly(8);
        assertThat(report.releasedBand()).containsExactly(4);
        assertThat(report.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.side()).isEqualTo(Side.HOTEL);
            assertThat(failure.slotId()).isEqualTo(4);
            assertThat(failure.errorCode()).isEqualTo(ErrorCode.RESERVATION_SERVICE_UNAVAILABLE);
        });
        assertThat(flakyHotel.getHeldSlots()).containsExactly(4);
        assertThat(band.getHeldSlots()).isEmpty();
    }
}
