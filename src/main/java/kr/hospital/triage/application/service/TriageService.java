package kr.hospital.triage.application.service;

import kr.hospital.triage.application.port.in.TriageUseCase;
import kr.hospital.triage.domain.patient.Patient;
import kr.hospital.triage.domain.queue.QueueEmptyException;
import kr.hospital.triage.domain.queue.QueueFullException;
import kr.hospital.triage.domain.queue.SeverityStatistics;
import kr.hospital.triage.domain.session.TriageSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 접수 창구 서비스
 * - 세션(대기열 + 접수 번호)은 애플리케이션당 하나
 * - 대기열 자체는 스레드 안전하지 않으므로 모든 호출을 하나의 락으로 직렬화한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TriageService implements TriageUseCase {

    private final TriageSession session;
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public PatientInfo admit(AdmitCommand command) {
        return withLock(() -> {
            Patient admitted = session.admit(command.patientId(), command.name(), command.severity())
                    .orElseThrow(() -> {
                        log.warn("접수 거절 - 대기열 가득 참: patientId={}, size={}",
                                command.patientId(), session.size());
                        return QueueFullException.of(session.capacity().getAsInt());
                    });

            log.info("환자 접수: patientId={}, name={}, severity={}, arrival=#{}, size={}",
                    admitted.id(), admitted.name(), admitted.severity(), admitted.arrivalTime(), session.size());
            return PatientInfo.from(admitted);
        });
    }

    @Override
    public PatientInfo serveNext() {
        return withLock(() -> {
            Patient served = session.serveNext()
                    .orElseThrow(() -> {
                        log.warn("진료 호출 실패 - 대기 환자 없음");
                        return QueueEmptyException.nothingToServe();
                    });

            log.info("진료 호출: patientId={}, name={}, arrival=#{}, remaining={}",
                    served.id(), served.name(), served.arrivalTime(), session.size());
            return PatientInfo.from(served);
        });
    }

    @Override
    public PatientInfo front() {
        return withLock(() -> session.peekFront()
                .map(PatientInfo::from)
                .orElseThrow(QueueEmptyException::nothingToView));
    }

    @Override
    public PatientInfo rear() {
        return withLock(() -> session.peekRear()
                .map(PatientInfo::from)
                .orElseThrow(QueueEmptyException::nothingToView));
    }

    @Override
    public List<PatientInfo> listPatients(TraversalOrder order) {
        return withLock(() -> {
            List<Patient> snapshot = order == TraversalOrder.BACKWARD
                    ? session.backwardSnapshot()
                    : session.forwardSnapshot();
            return snapshot.stream()
                    .map(PatientInfo::from)
                    .toList();
        });
    }

    @Override
    public QueueStatus status() {
        return withLock(() -> {
            int size = session.size();
            OptionalInt capacity = session.capacity();

            Integer cap = capacity.isPresent() ? capacity.getAsInt() : null;
            Double usage = cap != null ? size * 100.0 / cap : null;

            return new QueueStatus(
                    size,
                    cap,
                    session.isFull(),
                    session.isEmpty(),
                    session.condition(),
                    usage
            );
        });
    }

    @Override
    public StatisticsInfo statistics() {
        return withLock(() -> {
            SeverityStatistics stats = session.statistics();
            OptionalInt capacity = session.capacity();

            return new StatisticsInfo(
                    stats.count(),
                    capacity.isPresent() ? capacity.getAsInt() : null,
                    stats.average().isPresent() ? stats.average().getAsDouble() : null,
                    stats.min().isPresent() ? stats.min().getAsInt() : null,
                    stats.max().isPresent() ? stats.max().getAsInt() : null
            );
        });
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
