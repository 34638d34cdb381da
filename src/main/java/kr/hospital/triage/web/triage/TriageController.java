package kr.hospital.triage.web.triage;

import kr.hospital.triage.application.port.in.TriageUseCase;
import kr.hospital.triage.application.port.in.TriageUseCase.TraversalOrder;
import kr.hospital.triage.web.triage.dto.AdmitPatientRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/triage")
@RequiredArgsConstructor
@Validated
public class TriageController {

    private final TriageUseCase triageUseCase;

    // 환자 접수 (맨 뒤에 추가)
    @PostMapping("/patients")
    public ResponseEntity<TriageUseCase.PatientInfo> admit(@RequestBody @Validated AdmitPatientRequest request) {
        var command = new TriageUseCase.AdmitCommand(request.id(), request.name(), request.severity());
        var result = triageUseCase.admit(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    // 다음 환자 진료 호출 (FIFO)
    @PostMapping("/serve")
    public ResponseEntity<TriageUseCase.PatientInfo> serveNext() {
        return ResponseEntity.ok(triageUseCase.serveNext());
    }

    @GetMapping("/front")
    public ResponseEntity<TriageUseCase.PatientInfo> front() {
        return ResponseEntity.ok(triageUseCase.front());
    }

    @GetMapping("/rear")
    public ResponseEntity<TriageUseCase.PatientInfo> rear() {
        return ResponseEntity.ok(triageUseCase.rear());
    }

    @GetMapping("/patients")
    public ResponseEntity<List<TriageUseCase.PatientInfo>> listPatients(
            @RequestParam(name = "order", defaultValue = "FORWARD") TraversalOrder order) {
        return ResponseEntity.ok(triageUseCase.listPatients(order));
    }

    @GetMapping("/status")
    public ResponseEntity<TriageUseCase.QueueStatus> status() {
        return ResponseEntity.ok(triageUseCase.status());
    }

    @GetMapping("/statistics")
    public ResponseEntity<TriageUseCase.StatisticsInfo> statistics() {
        return ResponseEntity.ok(triageUseCase.statistics());
    }
}
