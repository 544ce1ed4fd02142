package personal.pair.booking.domain.model;

/**
 * 예약 대상 서비스 구분
 * 양쪽 작업은 항상 HOTEL → BAND 순서로 수행 (보상 트랜잭션 추론을 위해 고정)
 */
public enum Side {
    HOTEL("hotel"),
    BAND("band");

    private final String label;

    Side(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public Side other() {
        return this == HOTEL ? BAND : HOTEL;
    }
}
