package com.rambopet.clinic_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A single vitals reading taken during an episode. Rows are never updated once written.
 */
@Entity
@Table(name = "vital_signs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VitalSigns {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "episode_id", nullable = false, updatable = false)
    private ClinicalEpisode episode;

    @Column(nullable = false, precision = 6, scale = 2, updatable = false)
    private BigDecimal weight;

    @Column(precision = 4, scale = 1, updatable = false)
    private BigDecimal temperature;

    @Column(updatable = false)
    private Integer heartRate;

    @Column(updatable = false)
    private Integer respiratoryRate;

    @Column(updatable = false)
    private Integer systolicPressure;

    @Column(updatable = false)
    private Integer diastolicPressure;

    @Column(precision = 3, scale = 1, updatable = false)
    private BigDecimal capillaryRefillTime;

    @Column(updatable = false)
    private Integer bodyConditionScore;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String notes;

    @CreationTimestamp
    @Column(name = "recorded_at", updatable = false)
    private LocalDateTime recordedAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "recorded_by", updatable = false)
    private User recordedBy;
}
