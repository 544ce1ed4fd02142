package personal.pair.booking.domain.model;

/**
 * 한쪽 서비스에 대한 작업 결과 상태
 */
public enum SideStatus {
    SUCCEEDED,
    ALREADY_HELD,   // 이미 보유 중이라 원격 호출 생략
    NOT_REQUESTED,
    SKIPPED,        // 앞 단계 실패로 시도하지 않음
    FAILED,
    COMPENSATED;    // 성공했으나 반대편 실패로 되돌림

    public boolean isSatisfied() {
        return this == SUCCEEDED || this == ALREADY_HELD || this == NOT_REQUESTED;
    }
}
