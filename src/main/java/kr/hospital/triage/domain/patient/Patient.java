package kr.hospital.triage.domain.patient;

/**
 * 접수 1건을 나타내는 환자 Value Object
 * - 필드 값 검증은 하지 않는다 (입력 검증은 접수 창구/API 계층 책임)
 * - arrivalTime 은 표시용 번호이며 대기열 순서를 결정하지 않는다
 */
public record Patient(
        long id,
        String name,
        int severity,       // 1(경증) ~ 5(위급)
        long arrivalTime    // 접수 순번
) {

    public static Patient of(long id, String name, int severity, long arrivalTime) {
        return new Patient(id, name, severity, arrivalTime);
    }
}
