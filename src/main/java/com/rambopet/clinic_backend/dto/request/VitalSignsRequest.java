package com.rambopet.clinic_backend.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VitalSignsRequest {

    @NotNull(message = "Weight is required")
    @DecimalMin(value = "0.01", message = "Weight must be greater than zero")
    private BigDecimal weight;

    @DecimalMin(value = "30.0", message = "Temperature must be at least 30.0 °C")
    @DecimalMax(value = "45.0", message = "Temperature must not exceed 45.0 °C")
    private BigDecimal temperature;

    @Min(value = 10, message = "Heart rate must be at least 10 bpm")
    @Max(value = 300, message = "Heart rate must not exceed 300 bpm")
    private Integer heartRate;

    @Min(value = 5, message = "Respiratory rate must be at least 5 rpm")
    @Max(value = 100, message = "Respiratory rate must not exceed 100 rpm")
    private Integer respiratoryRate;

    @Min(value = 0, message = "Systolic pressure must not be negative")
    private Integer systolicPressure;

    @Min(value = 0, message = "Diastolic pressure must not be negative")
    private Integer diastolicPressure;

    @DecimalMin(value = "0.1", message = "Capillary refill time must be at least 0.1 s")
    @DecimalMax(value = "10.0", message = "Capillary refill time must not exceed 10.0 s")
    private BigDecimal capillaryRefillTime;

    @Min(value = 1, message = "Body condition score must be between 1 and 9")
    @Max(value = 9, message = "Body condition score must be between 1 and 9")
    private Integer bodyConditionScore;

    private String notes;
}
