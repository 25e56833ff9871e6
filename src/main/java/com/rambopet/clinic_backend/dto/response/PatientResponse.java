package com.rambopet.clinic_backend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rambopet.clinic_backend.enums.Sex;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PatientResponse {
    private UUID id;
    private UUID guardianId;
    private String guardianName;
    private String name;
    private UUID speciesId;
    private String speciesName;
    private UUID breedId;
    private String breedName;
    private Sex sex;
    private LocalDate birthDate;
    private Integer ageInYears;
    private String color;
    private BigDecimal currentWeight;
    private String microchip;
    private String photo;
    private boolean neutered;
    private String allergies;
    private String chronicConditions;
    private String notes;
    private boolean active;
    private boolean deceased;
    private LocalDate dateOfDeath;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
