package personal.pair.booking.domain.exception;

import personal.pair.booking.domain.model.Side;
import personal.pair.common.exception.BusinessException;
import personal.pair.common.exception.ErrorCode;

/**
 * Reservation Service Exception
 * 예약 서버 호출 실패의 공통 상위 예외 (어느 서비스에서 발생했는지 포함)
 */
public class ReservationServiceException extends BusinessException {

    private final Side side;

    public ReservationServiceException(ErrorCode errorCode, Side side, String message) {
        super(errorCode, message);
        this.side = side;
    }

    public ReservationServiceException(ErrorCode errorCode, Side side, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.side = side;
    }

    public Side getSide() {
        return side;
    }

    /**
     * 상태 코드에 맞는 구체 예외 생성
     */
    public static ReservationServiceException of(ErrorCode errorCode, Side side, String reason) {
        return switch (errorCode) {
            case BAD_REQUEST -> new BadRequestException(side, reason);
            case INVALID_TOKEN -> new InvalidTokenException(side, reason);
            case BAD_SLOT -> new BadSlotException(side, reason);
            case NOT_PROCESSED -> new NotProcessedException(side, reason);
            case SLOT_UNAVAILABLE -> new SlotUnavailableException(side, reason);
            case RESERVATION_LIMIT_EXCEEDED -> new ReservationLimitExceededException(side, reason);
            case RESERVATION_SERVICE_UNAVAILABLE -> new ReservationServiceUnavailableException(side, reason);
            default -> new ReservationServiceException(errorCode, side, reason);
        };
    }
}
