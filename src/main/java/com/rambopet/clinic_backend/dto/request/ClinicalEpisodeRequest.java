package com.rambopet.clinic_backend.dto.request;

import com.rambopet.clinic_backend.enums.Prognosis;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Patient, veterinarian and reason may be left empty; they are then taken from the appointment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClinicalEpisodeRequest {

    private UUID appointmentId;

    private UUID patientId;

    private UUID veterinarianId;

    private String reason;

    private String history;

    private String physicalExam;

    private String presumptiveDiagnosis;

    private String definitiveDiagnosis;

    private String treatmentPlan;

    private String medications;

    private String procedures;

    private Prognosis prognosis;

    private String homeCareInstructions;

    private LocalDate nextCheckUp;
}
