package kr.hospital.triage.domain.patient;

// 중증도 범위 정책 (검증은 입력 계층에서만 사용)
public final class TriagePolicy {
    private TriagePolicy() {}

    public static final int MIN_SEVERITY = 1;
    public static final int MAX_SEVERITY = 5;
}
