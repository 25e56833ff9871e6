package com.rambopet.clinic_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VitalSignsResponse {
    private UUID id;
    private UUID episodeId;
    private BigDecimal weight;
    private BigDecimal temperature;
    private Integer heartRate;
    private Integer respiratoryRate;
    private Integer systolicPressure;
    private Integer diastolicPressure;
    private BigDecimal capillaryRefillTime;
    private Integer bodyConditionScore;
    private String notes;
    private LocalDateTime recordedAt;
    private UUID recordedById;
    private String recordedByName;
}
