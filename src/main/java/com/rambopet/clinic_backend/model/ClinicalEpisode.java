package com.rambopet.clinic_backend.model;

import com.rambopet.clinic_backend.enums.Prognosis;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "clinical_episodes", indexes = {
        @Index(name = "idx_episodes_patient_created", columnList = "patient_id, created_at"),
        @Index(name = "idx_episodes_vet_created", columnList = "veterinarian_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClinicalEpisode {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "appointment_id", nullable = false, unique = true)
    private Appointment appointment;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "patient_id", nullable = false)
    private Patient patient;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "veterinarian_id")
    private User veterinarian;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String reason;

    @Column(columnDefinition = "TEXT")
    private String history;

    @Column(columnDefinition = "TEXT")
    private String physicalExam;

    @Column(columnDefinition = "TEXT")
    private String presumptiveDiagnosis;

    @Column(columnDefinition = "TEXT")
    private String definitiveDiagnosis;

    @Column(columnDefinition = "TEXT")
    private String treatmentPlan;

    @Column(columnDefinition = "TEXT")
    private String medications;

    @Column(columnDefinition = "TEXT")
    private String procedures;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    @Builder.Default
    private Prognosis prognosis = Prognosis.GOOD;

    @Column(columnDefinition = "TEXT")
    private String homeCareInstructions;

    private LocalDate nextCheckUp;

    @Builder.Default
    private boolean closed = false;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public String getSummaryDiagnosis() {
        if (definitiveDiagnosis != null && !definitiveDiagnosis.isBlank()) {
            return definitiveDiagnosis;
        }
        return presumptiveDiagnosis;
    }

    // Fills patient, veterinarian and reason from the appointment when they were not supplied
    public void applyAppointmentDefaults() {
        if (appointment == null) {
            return;
        }
        if (patient == null) {
            patient = appointment.getPatient();
        }
        if (veterinarian == null && appointment.getVeterinarian() != null) {
            veterinarian = appointment.getVeterinarian();
        }
        if (reason == null || reason.isBlank()) {
            reason = appointment.getReason();
        }
    }
}
