package com.rambopet.clinic_backend.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeceasedRequest {

    @NotNull(message = "Date of death is required")
    @PastOrPresent(message = "Date of death cannot be in the future")
    private LocalDate dateOfDeath;
}
