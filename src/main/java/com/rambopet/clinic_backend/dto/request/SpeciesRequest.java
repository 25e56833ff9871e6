package com.rambopet.clinic_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpeciesRequest {

    @NotBlank(message = "Species name is required")
    @Size(max = 50)
    private String name;

    private String description;

    private Boolean active;
}
