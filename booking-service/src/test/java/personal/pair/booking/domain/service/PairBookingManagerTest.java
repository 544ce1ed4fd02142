package personal.pair.booking.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.pair.booking.application.port.out.ReservationService;
import personal.pair.booking.domain.exception.ReservationServiceUnavailableException;
import personal.pair.booking.domain.exception.SlotUnavailableException;
import personal.pair.booking.domain.model.HeldSlots;
import personal.pair.booking.domain.model.PairResult;
import personal.pair.booking.domain.model.Receipt;
import personal.pair.booking.domain.model.Side;
import personal.pair.booking.domain.model.SideStatus;
import personal.pair.common.exception.ErrorCode;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("PairBookingManager 단위 테스트")
class PairBookingManagerTest {

    private static final int SLOT_ID = 7;

    @Mock
    private ReservationService hotel;
    @Mock
    private ReservationService band;

    private PairBookingManager bookingManager;

    @BeforeEach
    void setUp() {
        given(hotel.side()).willReturn(Side.HOTEL);
        given(band.side()).willReturn(Side.BAND);
        bookingManager = new PairBookingManager(
                new ReservationServicePair(hotel, band, new RateLimiter(Duration.ZERO)));
    }

    @Test
    @DisplayName("양쪽 예약 성공 - HOTEL 먼저, BAND 나중")
    void reserveBoth_Success() {
        // given
        given(hotel.reserveSlot(SLOT_ID)).willReturn(new Receipt(Side.HOTEL, SLOT_ID, "ok"));
        given(band.reserveSlot(SLOT_ID)).willReturn(new Receipt(Side.BAND, SLOT_ID, "ok"));

        // when
        PairResult result = bookingManager.reserveBoth(SLOT_ID);

        // then
        assertThat(result.succeeded()).isTrue();
        assertThat(result.hotel().status()).isEqualTo(SideStatus.SUCCEEDED);
        assertThat(result.band().status()).isEqualTo(SideStatus.SUCCEEDED);
        InOrder order = inOrder(hotel, band);
        order.verify(hotel).reserveSlot(SLOT_ID);
        order.verify(band).reserveSlot(SLOT_ID);
    }

    @Test
    @DisplayName("HOTEL 예약 실패 - BAND 는 시도하지 않음")
    void reserveBoth_FirstFails() {
        // given
        given(hotel.reserveSlot(SLOT_ID)).willThrow(new SlotUnavailableException(Side.HOTEL, "taken"));

        // when
        PairResult result = bookingManager.reserveBoth(SLOT_ID);

        // then
        assertThat(result.succeeded()).isFalse();
        assertThat(result.inconsistent()).isFalse();
        assertThat(result.hotel().errorCode()).isEqualTo(ErrorCode.SLOT_UNAVAILABLE);
        assertThat(result.band().status()).isEqualTo(SideStatus.SKIPPED);
        verify(band, never()).reserveSlot(anyInt());
    }

    @Test
    @DisplayName("BAND 예약 실패 - HOTEL 예약을 반납해서 되돌림")
    void reserveBoth_SecondFails_Compensated() {
        // given
        given(hotel.reserveSlot(SLOT_ID)).willReturn(new Receipt(Side.HOTEL, SLOT_ID, "ok"));
        given(band.reserveSlot(SLOT_ID)).willThrow(new SlotUnavailableException(Side.BAND, "taken"));
        given(hotel.releaseSlot(SLOT_ID)).willReturn(new Receipt(Side.HOTEL, SLOT_ID, "released"));

        // when
        PairResult result = bookingManager.reserveBoth(SLOT_ID);

        // then
        assertThat(result.succeeded()).isFalse();
        assertThat(result.inconsistent()).isFalse();
        assertThat(result.hotel().status()).isEqualTo(SideStatus.COMPENSATED);
        assertThat(result.band().status()).isEqualTo(SideStatus.FAILED);
        assertThat(result.firstFailure()).hasValueSatisfying(failure ->
                assertThat(failure.side()).isEqualTo(Side.BAND));
        verify(hotel).releaseSlot(SLOT_ID);
    }

    @Test
    @DisplayName("BAND 예약 실패 후 되돌리기도 실패 - inconsistent 로 표시")
    void reserveBoth_CompensationFails_Inconsistent() {
        // given
        given(hotel.reserveSlot(SLOT_ID)).willReturn(new Receipt(Side.HOTEL, SLOT_ID, "ok"));
        given(band.reserveSlot(SLOT_ID)).willThrow(new SlotUnavailableException(Side.BAND, "taken"));
        given(hotel.releaseSlot(SLOT_ID)).willThrow(new ReservationServiceUnavailableException(Side.HOTEL, "down"));

        // when
        PairResult result = bookingManager.reserveBoth(SLOT_ID);

        // then
        assertThat(result.inconsistent()).isTrue();
        assertThat(result.succeeded()).isFalse();
        assertThat(result.hotel().status()).isEqualTo(SideStatus.SUCCEEDED);
    }

    @Test
    @DisplayName("BAND 취소 실패 - HOTEL 을 다시 예약해서 되돌림")
    void cancelBoth_SecondFails_Compensated() {
        // given
        given(hotel.releaseSlot(SLOT_ID)).willReturn(new Receipt(Side.HOTEL, SLOT_ID, "released"));
        given(band.releaseSlot(SLOT_ID)).willThrow(new ReservationServiceUnavailableException(Side.BAND, "down"));
        given(hotel.reserveSlot(SLOT_ID)).willReturn(new Receipt(Side.HOTEL, SLOT_ID, "ok"));

        // when
        PairResult result = bookingManager.cancelBoth(SLOT_ID);

        // then
        assertThat(result.succeeded()).isFalse();
        assertThat(result.hotel().status()).isEqualTo(SideStatus.COMPENSATED);
        assertThat(result.band().errorCode()).isEqualTo(ErrorCode.RESERVATION_SERVICE_UNAVAILABLE);
        verify(hotel).reserveSlot(SLOT_ID);
    }

    @Test
    @DisplayName("BAND 취소 실패 후 HOTEL 재예약도 실패 - inconsistent 로 표시")
    void cancelBoth_CompensationFails_Inconsistent() {
        // given
        given(hotel.releaseSlot(SLOT_ID)).willReturn(new Receipt(Side.HOTEL, SLOT_ID, "released"));
        given(band.releaseSlot(SLOT_ID)).willThrow(new ReservationServiceUnavailableException(Side.BAND, "down"));
        given(hotel.reserveSlot(SLOT_ID)).willThrow(new SlotUnavailableException(Side.HOTEL, "taken"));

        // when
        PairResult result = bookingManager.cancelBoth(SLOT_ID);

        // then
        assertThat(result.inconsistent()).isTrue();
        assertThat(result.succeeded()).isFalse();
        assertThat(result.hotel().status()).isEqualTo(SideStatus.SUCCEEDED);
        assertThat(result.band().status()).isEqualTo(SideStatus.FAILED);
        InOrder order = inOrder(hotel, band);
        order.verify(hotel).releaseSlot(SLOT_ID);
        order.verify(band).releaseSlot(SLOT_ID);
        order.verify(hotel).reserveSlot(SLOT_ID);
    }

    @Test
    @DisplayName("한쪽만 취소 - 다른 쪽은 NOT_REQUESTED")
    void cancelOne() {
        // given
        given(band.releaseSlot(SLOT_ID)).willReturn(new Receipt(Side.BAND, SLOT_ID, "released"));

        // when
        PairResult result = bookingManager.cancelOne(SLOT_ID, Side.BAND);

        // then
        assertThat(result.succeeded()).isTrue();
        assertThat(result.hotel().status()).isEqualTo(SideStatus.NOT_REQUESTED);
        assertThat(result.band().receipt().message()).isEqualTo("released");
        verify(hotel, never()).releaseSlot(anyInt());
    }

    @Test
    @DisplayName("이미 보유한 쪽은 원격 호출 없이 ALREADY_HELD")
    void reserveMissing_SkipsHeldSide() {
        // given
        HeldSlots held = HeldSlots.of(Set.of(SLOT_ID), Set.of());
        given(band.reserveSlot(SLOT_ID)).willReturn(new Receipt(Side.BAND, SLOT_ID, "ok"));

        // when
        PairResult result = bookingManager.reserveMissing(SLOT_ID, EnumSet.allOf(Side.class), held);

        // then
        assertThat(result.succeeded()).isTrue();
        assertThat(result.hotel().status()).isEqualTo(SideStatus.ALREADY_HELD);
        assertThat(result.band().status()).isEqualTo(SideStatus.SUCCEEDED);
        verify(hotel, never()).reserveSlot(anyInt());
    }

    @Test
    @DisplayName("양쪽 모두 이미 보유 - 아무 호출 없이 성공")
    void reserveMissing_AlreadyHeldBoth() {
        // given
        HeldSlots held = HeldSlots.of(Set.of(SLOT_ID), Set.of(SLOT_ID));

        // when
        PairResult result = bookingManager.reserveMissing(SLOT_ID, EnumSet.allOf(Side.class), held);

        // then
        assertThat(result.succeeded()).isTrue();
        verify(hotel, never()).reserveSlot(anyInt());
        verify(band, never()).reserveSlot(anyInt());
    }
}
