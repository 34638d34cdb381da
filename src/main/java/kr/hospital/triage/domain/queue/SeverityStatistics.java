package kr.hospital.triage.domain.queue;

import kr.hospital.triage.domain.patient.Patient;

import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * 대기열 스냅샷에 대한 중증도 통계
 * 비어 있는 스냅샷이면 평균/최소/최대 값이 없다
 */
public record SeverityStatistics(
        int count,
        OptionalDouble average,
        OptionalInt min,
        OptionalInt max
) {

    public static SeverityStatistics of(List<Patient> snapshot) {
        if (snapshot.isEmpty()) {
            return new SeverityStatistics(0, OptionalDouble.empty(), OptionalInt.empty(), OptionalInt.empty());
        }

        IntSummaryStatistics stats = snapshot.stream()
                .mapToInt(Patient::severity)
                .summaryStatistics();

        return new SeverityStatistics(
                (int) stats.getCount(),
                OptionalDouble.of(stats.getAverage()),
                OptionalInt.of(stats.getMin()),
                OptionalInt.of(stats.getMax())
        );
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
