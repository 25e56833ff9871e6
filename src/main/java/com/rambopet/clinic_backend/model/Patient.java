package com.rambopet.clinic_backend.model;

import com.rambopet.clinic_backend.enums.Sex;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Period;
import java.util.UUID;

@Entity
@Table(name = "patients", indexes = {
        @Index(name = "idx_patients_guardian_active", columnList = "guardian_id, is_active"),
        @Index(name = "idx_patients_microchip", columnList = "microchip")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Patient {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "guardian_id", nullable = false)
    private User guardian;

    @Column(nullable = false, length = 100)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "species_id", nullable = false)
    private Species species;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "breed_id")
    private Breed breed;

    @Column(length = 1)
    @Builder.Default
    private Sex sex = Sex.UNKNOWN;

    private LocalDate birthDate;

    @Column(length = 100)
    private String color;

    @Column(precision = 6, scale = 2)
    private BigDecimal currentWeight;

    @Column(unique = true, length = 50)
    private String microchip;

    private String photo;

    @Builder.Default
    private boolean neutered = false;

    @Column(columnDefinition = "TEXT")
    private String allergies;

    @Column(columnDefinition = "TEXT")
    private String chronicConditions;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "is_active")
    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private boolean deceased = false;

    private LocalDate dateOfDeath;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Whole years between the birth date and {@code today}, or {@code null} when the birth date is unknown.
     */
    public Integer ageInYears(LocalDate today) {
        if (birthDate == null) {
            return null;
        }
        return Period.between(birthDate, today).getYears();
    }

    public void markDeceased(LocalDate date) {
        this.deceased = true;
        this.dateOfDeath = date;
        this.active = false;
    }
}
