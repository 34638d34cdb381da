package kr.hospital.triage.application.port.in;

import kr.hospital.triage.domain.patient.Patient;
import kr.hospital.triage.domain.queue.QueueCondition;

import java.util.List;

public interface TriageUseCase {

    record AdmitCommand(long patientId, String name, int severity) {}

    record PatientInfo(
            long id,
            String name,
            int severity,
            long arrivalNumber
    ) {
        public static PatientInfo from(Patient patient) {
            return new PatientInfo(patient.id(), patient.name(), patient.severity(), patient.arrivalTime());
        }
    }

    record QueueStatus(
            int size,
            Integer capacity,       // null 이면 무제한
            boolean full,
            boolean empty,
            QueueCondition condition,
            Double usagePercent     // 무제한이면 null
    ) {}

    record StatisticsInfo(
            int totalPatients,
            Integer capacity,
            Double averageSeverity,
            Integer minSeverity,
            Integer maxSeverity
    ) {}

    enum TraversalOrder { FORWARD, BACKWARD }

    PatientInfo admit(AdmitCommand command);
    PatientInfo serveNext();
    PatientInfo front();
    PatientInfo rear();
    List<PatientInfo> listPatients(TraversalOrder order);
    QueueStatus status();
    StatisticsInfo statistics();
}
