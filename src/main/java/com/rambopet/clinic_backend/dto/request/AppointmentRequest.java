package com.rambopet.clinic_backend.dto.request;

import com.rambopet.clinic_backend.enums.AppointmentType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentRequest {

    @NotNull(message = "Patient is required")
    private UUID patientId;

    // Defaults to the patient's guardian
    private UUID guardianId;

    private UUID veterinarianId;

    @NotNull(message = "Scheduled date and time is required")
    private LocalDateTime scheduledAt;

    @Min(value = 5, message = "Duration must be at least 5 minutes")
    @Max(value = 480, message = "Duration must not exceed 480 minutes")
    private Integer durationMinutes;

    private AppointmentType type;

    @NotBlank(message = "Reason is required")
    private String reason;

    private String notes;

    private String internalNotes;
}
