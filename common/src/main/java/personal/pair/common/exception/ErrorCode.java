package personal.pair.common.exception;

import org.springframework.http.HttpStatus;

import java.util.Arrays;
import java.util.Optional;

/**
 * 에러 코드 정의
 * 예약 서버가 돌려주는 HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C002", "내부 오류가 발생했습니다."),

    // Reservation Server (Rxxx) - 서버가 의미 있는 4xx로 응답한 경우
    BAD_REQUEST(HttpStatus.BAD_REQUEST, "R001", "잘못된 예약 요청입니다."),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "R002", "유효하지 않은 API 토큰입니다."),
    BAD_SLOT(HttpStatus.FORBIDDEN, "R003", "존재하지 않는 슬롯입니다."),
    NOT_PROCESSED(HttpStatus.NOT_FOUND, "R004", "요청이 처리되지 않았습니다."),
    SLOT_UNAVAILABLE(HttpStatus.CONFLICT, "R005", "이미 선점된 슬롯입니다."),
    RESERVATION_LIMIT_EXCEEDED(HttpStatus.UNAVAILABLE_FOR_LEGAL_REASONS, "R006", "보유 가능한 슬롯 수를 초과했습니다."),

    // External Service (Exxx)
    RESERVATION_SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "E001", "예약 서버에 연결할 수 없습니다."),
    UNEXPECTED_STATUS(HttpStatus.BAD_GATEWAY, "E002", "예약 서버가 예상하지 못한 응답을 반환했습니다.");

    private static final ErrorCode[] CLIENT_ERRORS = {
            BAD_REQUEST, INVALID_TOKEN, BAD_SLOT, NOT_PROCESSED, SLOT_UNAVAILABLE, RESERVATION_LIMIT_EXCEEDED
    };

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    /**
     * 예약 서버의 4xx 응답 코드를 에러 코드로 변환
     * 의미가 정의되지 않은 상태 코드는 empty
     */
    public static Optional<ErrorCode> fromClientStatus(int statusCode) {
        return Arrays.stream(CLIENT_ERRORS)
                .filter(errorCode -> errorCode.httpStatus.value() == statusCode)
                .findFirst();
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
