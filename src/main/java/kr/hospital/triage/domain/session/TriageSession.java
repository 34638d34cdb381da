package kr.hospital.triage.domain.session;

import kr.hospital.triage.domain.patient.Patient;
import kr.hospital.triage.domain.queue.QueueCondition;
import kr.hospital.triage.domain.queue.SeverityStatistics;
import kr.hospital.triage.domain.queue.TriageQueue;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 접수 창구 세션
 * - 대기열과 접수 순번 카운터를 함께 보관한다
 * - 접수 시도마다 카운터를 먼저 증가시키므로, 거절된 접수도 번호를 소비한다
 * - 동기화하지 않는다 (TriageService 가 직렬화)
 */
public class TriageSession {

    private final TriageQueue queue;
    private long arrivalCounter;

    public TriageSession(TriageQueue queue) {
        this.queue = queue;
        this.arrivalCounter = 0L;
    }

    public static TriageSession withCapacity(Integer capacity) {
        return new TriageSession(TriageQueue.of(capacity));
    }

    /**
     * 접수 번호를 부여해 환자를 대기열에 추가한다.
     *
     * @return 접수된 환자, 가득 찬 경우 Optional.empty()
     */
    public Optional<Patient> admit(long patientId, String name, int severity) {
        arrivalCounter++;
        Patient patient = Patient.of(patientId, name, severity, arrivalCounter);
        return queue.arrive(patient) ? Optional.of(patient) : Optional.empty();
    }

    public Optional<Patient> serveNext() {
        return queue.serveNext();
    }

    public Optional<Patient> peekFront() {
        return queue.peekFront();
    }

    public Optional<Patient> peekRear() {
        return queue.peekRear();
    }

    public List<Patient> forwardSnapshot() {
        return queue.traverseForward();
    }

    public List<Patient> backwardSnapshot() {
        return queue.traverseBackward();
    }

    public SeverityStatistics statistics() {
        return SeverityStatistics.of(queue.traverseForward());
    }

    public boolean isFull() {
        return queue.isFull();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public OptionalInt capacity() {
        return queue.capacity();
    }

    public QueueCondition condition() {
        return queue.condition();
    }

    // 마지막으로 부여한 접수 번호
    public long lastArrivalNumber() {
        return arrivalCounter;
    }
}
