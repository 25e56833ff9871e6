package com.rambopet.clinic_backend.dto.request;

import com.rambopet.clinic_backend.enums.Sex;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientRequest {

    // Ignored for guardians, who always register their own patients
    private UUID guardianId;

    @NotBlank(message = "Patient name is required")
    @Size(max = 100)
    private String name;

    @NotNull(message = "Species is required")
    private UUID speciesId;

    private UUID breedId;

    private Sex sex;

    @PastOrPresent(message = "Birth date cannot be in the future")
    private LocalDate birthDate;

    @Size(max = 100)
    private String color;

    @DecimalMin(value = "0.01", message = "Weight must be greater than zero")
    private BigDecimal currentWeight;

    @Size(max = 50)
    private String microchip;

    private Boolean neutered;

    private String allergies;

    private String chronicConditions;

    private String notes;
}
