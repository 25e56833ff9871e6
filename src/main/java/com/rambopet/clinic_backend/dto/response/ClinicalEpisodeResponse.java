package com.rambopet.clinic_backend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rambopet.clinic_backend.enums.Prognosis;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClinicalEpisodeResponse {
    private UUID id;
    private UUID appointmentId;
    private LocalDateTime appointmentScheduledAt;
    private UUID patientId;
    private String patientName;
    private UUID veterinarianId;
    private String veterinarianName;
    private String reason;
    private String history;
    private String physicalExam;
    private String presumptiveDiagnosis;
    private String definitiveDiagnosis;
    private String summaryDiagnosis;
    private String treatmentPlan;
    private String medications;
    private String procedures;
    private Prognosis prognosis;
    private String homeCareInstructions;
    private LocalDate nextCheckUp;
    private boolean closed;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
