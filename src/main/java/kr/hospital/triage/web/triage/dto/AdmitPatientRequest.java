package kr.hospital.triage.web.triage.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.hospital.triage.domain.patient.TriagePolicy;

public record AdmitPatientRequest(
        @NotNull(message = "환자 ID는 필수입니다")
        Long id,

        @NotBlank(message = "환자 이름은 비어있을 수 없습니다")
        String name,

        @NotNull(message = "중증도는 필수입니다")
        @Min(value = TriagePolicy.MIN_SEVERITY, message = "중증도는 1 이상이어야 합니다")
        @Max(value = TriagePolicy.MAX_SEVERITY, message = "중증도는 5 이하이어야 합니다")
        Integer severity
) {}
