package personal.pair.booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Booking Application
 * 호텔/밴드 두 예약 서버에 걸쳐 같은 슬롯을 짝으로 확보하는 예약 조율 서비스
 */
@SpringBootApplication
public class BookingApplication {
    public static void main(String[] args) {
        SpringApplication.run(BookingApplication.class, args);
    }
}
