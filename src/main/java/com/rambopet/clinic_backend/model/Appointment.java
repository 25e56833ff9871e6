package com.rambopet.clinic_backend.model;

import com.rambopet.clinic_backend.enums.AppointmentStatus;
import com.rambopet.clinic_backend.enums.AppointmentType;
import com.rambopet.clinic_backend.exception.InvalidStateTransitionException;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "appointments", indexes = {
        @Index(name = "idx_appointments_scheduled_status", columnList = "scheduled_at, status"),
        @Index(name = "idx_appointments_patient_status", columnList = "patient_id, status"),
        @Index(name = "idx_appointments_vet_scheduled", columnList = "veterinarian_id, scheduled_at"),
        @Index(name = "idx_appointments_guardian_scheduled", columnList = "guardian_id, scheduled_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    public static final int DEFAULT_DURATION_MINUTES = 30;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "patient_id", nullable = false)
    private Patient patient;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "guardian_id", nullable = false)
    private User guardian;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "veterinarian_id")
    private User veterinarian;

    @Column(name = "scheduled_at", nullable = false)
    private LocalDateTime scheduledAt;

    @Column(nullable = false)
    @Builder.Default
    private int durationMinutes = DEFAULT_DURATION_MINUTES;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private AppointmentType type = AppointmentType.GENERAL_CONSULTATION;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AppointmentStatus status = AppointmentStatus.BOOKED;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String reason;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(columnDefinition = "TEXT")
    private String internalNotes;

    @Builder.Default
    private boolean reminderSent = false;

    private LocalDateTime reminderSentAt;

    private LocalDateTime confirmedAt;

    private LocalDateTime attendedAt;

    private LocalDateTime cancelledAt;

    @Column(columnDefinition = "TEXT")
    private String cancellationReason;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by")
    private User createdBy;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public LocalDateTime getEstimatedEnd() {
        return scheduledAt == null ? null : scheduledAt.plusMinutes(durationMinutes);
    }

    public boolean isOverdue(LocalDateTime now) {
        return scheduledAt != null && scheduledAt.isBefore(now) && !status.isTerminal();
    }

    public boolean isCancellable() {
        return AppointmentStatus.PENDING.contains(status);
    }

    public boolean isEditable() {
        return AppointmentStatus.PENDING.contains(status);
    }

    public void confirm(LocalDateTime now) {
        requireStatus(Set.of(AppointmentStatus.BOOKED), "confirm");
        this.status = AppointmentStatus.CONFIRMED;
        this.confirmedAt = now;
    }

    public void start() {
        requireStatus(AppointmentStatus.PENDING, "start");
        this.status = AppointmentStatus.IN_PROGRESS;
    }

    public void complete(LocalDateTime now) {
        requireStatus(Set.of(AppointmentStatus.IN_PROGRESS), "complete");
        this.status = AppointmentStatus.COMPLETED;
        this.attendedAt = now;
    }

    public void cancel(String reason, LocalDateTime now) {
        requireStatus(AppointmentStatus.PENDING, "cancel");
        this.status = AppointmentStatus.CANCELLED;
        this.cancelledAt = now;
        this.cancellationReason = reason;
    }

    public void markNoShow() {
        requireStatus(AppointmentStatus.PENDING, "mark as no-show");
        this.status = AppointmentStatus.NO_SHOW;
    }

    public void markReminderSent(LocalDateTime now) {
        this.reminderSent = true;
        this.reminderSentAt = now;
    }

    public void clearReminderSent() {
        this.reminderSent = false;
        this.reminderSentAt = null;
    }

    private void requireStatus(Set<AppointmentStatus> allowed, String action) {
        if (!allowed.contains(status)) {
            throw new InvalidStateTransitionException("appointment", status, action);
        }
    }
}
