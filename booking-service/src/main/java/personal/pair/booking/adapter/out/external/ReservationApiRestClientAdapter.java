package personal.pair.booking.adapter.out.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import personal.pair.booking.application.port.out.ReservationService;
import personal.pair.booking.domain.exception.ReservationServiceException;
import personal.pair.booking.domain.exception.ReservationServiceUnavailableException;
import personal.pair.booking.domain.model.Receipt;
import personal.pair.booking.domain.model.Side;
import personal.pair.common.exception.ErrorCode;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Reservation API REST Client Adapter
 * 호텔/밴드 예약 서버와 HTTP 통신하는 구현체 (RestClient 사용, 서비스마다 인스턴스 하나)
 *
 * 에러 처리:
 * - 400/401/403/404/409/451: 의미 있는 클라이언트 에러 → 구체 예외로 변환, 재시도 없음
 * - 기타 4xx, 1xx/3xx: UNEXPECTED_STATUS, 재시도 없음
 * - 5xx, 연결 실패, Timeout, 응답 파싱 실패: Retry 로 재시도 후 ReservationServiceUnavailableException
 */
@Slf4j
public class ReservationApiRestClientAdapter implements ReservationService {

    private static final ParameterizedTypeReference<List<SlotResponse>> SLOT_LIST = new ParameterizedTypeReference<>() {
    };

    private final Side side;
    private final RestClient restClient;
    private final String token;
    private final Retry retry;
    private final ObjectMapper objectMapper;

    public ReservationApiRestClientAdapter(Side side, RestClient restClient, String token,
                                           Retry retry, ObjectMapper objectMapper) {
        this.side = side;
        this.restClient = restClient;
        this.token = token;
        this.retry = retry;
        this.objectMapper = objectMapper;

        retry.getEventPublisher().onRetry(event -> log.warn("Server error from {} (attempt {}): {}",
                side.label(), event.getNumberOfRetryAttempts(),
                event.getLastThrowable() == null ? "-" : event.getLastThrowable().getMessage()));
    }

    @Override
    public Side side() {
        return side;
    }

    @Override
    public Set<Integer> getAvailableSlots() {
        return toSlotIds(call("GET /reservation/available", () -> restClient.get()
                .uri("/reservation/available")
                .headers(headers -> headers.setBearerAuth(token))
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), (request, response) -> {
                    throw toException(response);
                })
                .body(SLOT_LIST)));
    }

    @Override
    public Set<Integer> getHeldSlots() {
        return toSlotIds(call("GET /reservation", () -> restClient.get()
                .uri("/reservation")
                .headers(headers -> headers.setBearerAuth(token))
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), (request, response) -> {
                    throw toException(response);
                })
                .body(SLOT_LIST)));
    }

    @Override
    public Receipt reserveSlot(int slotId) {
        ReservationResponse response = call("POST /reservation/" + slotId, () -> restClient.post()
                .uri("/reservation/{slotId}", slotId)
                .headers(headers -> headers.setBearerAuth(token))
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), (request, resp) -> {
                    throw toException(resp);
                })
                .body(ReservationResponse.class));
        return toReceipt(slotId, response, "Slot reserved");
    }

    @Override
    public Receipt releaseSlot(int slotId) {
        ReservationResponse response = call("DELETE /reservation/" + slotId, () -> restClient.delete()
                .uri("/reservation/{slotId}", slotId)
                .headers(headers -> headers.setBearerAuth(token))
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), (request, resp) -> {
                    throw toException(resp);
                })
                .body(ReservationResponse.class));
        return toReceipt(slotId, response, "Slot released");
    }

    /**
     * Retry 로 감싼 호출
     * 연결 실패/파싱 실패(RestClientException)는 재시도 대상으로 변환
     */
    private <T> T call(String operation, Supplier<T> request) {
        Supplier<T> guarded = () -> {
            try {
                log.debug("Sending request to {}: {}", side.label(), operation);
                return request.get();
            } catch (RestClientException e) {
                throw new ReservationServiceUnavailableException(side,
                        "Request error on " + operation + ": " + e.getMessage(), e);
            }
        };

        try {
            return Retry.decorateSupplier(retry, guarded).get();
        } catch (ReservationServiceUnavailableException e) {
            int attempts = retry.getRetryConfig().getMaxAttempts();
            log.error("{} {} failed after {} attempts: {}", side.label(), operation, attempts, e.getMessage());
            throw new ReservationServiceUnavailableException(side,
                    "Failed after " + attempts + " attempts: " + e.getMessage(), e);
        }
    }

    private ReservationServiceException toException(ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        String reason = reason(response);

        if (response.getStatusCode().is5xxServerError()) {
            return new ReservationServiceUnavailableException(side, "Server error " + status + ": " + reason);
        }

        return ErrorCode.fromClientStatus(status)
                .map(errorCode -> {
                    log.warn("{} rejected request: status={}, reason={}", side.label(), status, reason);
                    return ReservationServiceException.of(errorCode, side, reason);
                })
                .orElseGet(() -> new ReservationServiceException(ErrorCode.UNEXPECTED_STATUS, side,
                        "Unexpected status code " + status + ": " + reason));
    }

    /**
     * 응답 본문의 message 를 우선 사용하고, 없으면 상태 줄의 reason 사용
     */
    private String reason(ClientHttpResponse response) throws IOException {
        byte[] body = response.getBody().readAllBytes();
        if (body.length > 0) {
            try {
                JsonNode json = objectMapper.readTree(body);
                if (json != null && json.hasNonNull("message")) {
                    return json.get("message").asText();
                }
            } catch (IOException e) {
                log.debug("Error body from {} is not JSON, falling back to status text", side.label());
            }
        }
        return response.getStatusText();
    }

    private Set<Integer> toSlotIds(List<SlotResponse> slots) {
        Set<Integer> ids = new TreeSet<>();
        if (slots != null) {
            slots.stream()
                    .filter(Objects::nonNull)
                    .map(SlotResponse::id)
                    .filter(Objects::nonNull)
                    .forEach(ids::add);
        }
        return ids;
    }

    private Receipt toReceipt(int slotId, ReservationResponse response, String defaultMessage) {
        String message = response == null || response.message() == null ? defaultMessage : response.message();
        return new Receipt(side, slotId, message);
    }
}
