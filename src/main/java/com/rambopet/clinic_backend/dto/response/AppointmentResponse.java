package com.rambopet.clinic_backend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rambopet.clinic_backend.enums.AppointmentStatus;
import com.rambopet.clinic_backend.enums.AppointmentType;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AppointmentResponse {
    private UUID id;
    private UUID patientId;
    private String patientName;
    private UUID guardianId;
    private String guardianName;
    private UUID veterinarianId;
    private String veterinarianName;
    private LocalDateTime scheduledAt;
    private LocalDateTime estimatedEnd;
    private int durationMinutes;
    private AppointmentType type;
    private AppointmentStatus status;
    private String reason;
    private String notes;
    // Left null for guardians
    private String internalNotes;
    private boolean reminderSent;
    private LocalDateTime reminderSentAt;
    private LocalDateTime confirmedAt;
    private LocalDateTime attendedAt;
    private LocalDateTime cancelledAt;
    private String cancellationReason;
    private boolean overdue;
    private boolean cancellable;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
