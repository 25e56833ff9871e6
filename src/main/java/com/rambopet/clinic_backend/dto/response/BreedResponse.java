package com.rambopet.clinic_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BreedResponse {
    private UUID id;
    private UUID speciesId;
    private String speciesName;
    private String name;
    private String description;
    private boolean active;
    private LocalDateTime createdAt;
}
