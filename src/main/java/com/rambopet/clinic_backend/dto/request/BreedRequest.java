package com.rambopet.clinic_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BreedRequest {

    @NotNull(message = "Species is required")
    private UUID speciesId;

    @NotBlank(message = "Breed name is required")
    @Size(max = 100)
    private String name;

    private String description;

    private Boolean active;
}
