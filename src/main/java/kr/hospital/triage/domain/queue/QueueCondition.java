package kr.hospital.triage.domain.queue;

/**
 * 대기열 상태를 나타내는 Enum
 */
public enum QueueCondition {

    EMPTY("비어있음"),     // 대기 환자 없음
    PARTIAL("대기중"),     // 추가 접수 가능
    FULL("가득참");        // 최대 수용 인원 도달

    private final String displayName;

    QueueCondition(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static QueueCondition of(int size, Integer capacity) {
        if (size == 0) {
            return EMPTY;
        }
        if (capacity != null && size >= capacity) {
            return FULL;
        }
        return PARTIAL;
    }

    // 접수 가능 여부
    public boolean canAdmit() {
        return this != FULL;
    }

    // 진료 호출 가능 여부
    public boolean canServe() {
        return this != EMPTY;
    }
}
