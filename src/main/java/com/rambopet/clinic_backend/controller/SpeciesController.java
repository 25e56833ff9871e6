package com.rambopet.clinic_backend.controller;

import com.rambopet.clinic_backend.dto.request.SpeciesRequest;
import com.rambopet.clinic_backend.dto.response.ApiResponse;
import com.rambopet.clinic_backend.dto.response.BreedResponse;
import com.rambopet.clinic_backend.dto.response.SpeciesResponse;
import com.rambopet.clinic_backend.service.SpeciesService;
import com.rambopet.clinic_backend.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/species")
@RequiredArgsConstructor
public class SpeciesController {

    private final SpeciesService speciesService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<SpeciesResponse>>> getAllSpecies(
            @RequestParam(defaultValue = "true") boolean activeOnly) {
        return ResponseEntity.ok(ApiResponse.success(speciesService.getAllSpecies(activeOnly)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<SpeciesResponse>> getSpeciesById(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(speciesService.getSpeciesById(id)));
    }

    @GetMapping("/{id}/breeds")
    public ResponseEntity<ApiResponse<List<BreedResponse>>> getBreeds(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(speciesService.getBreedsForSpecies(id)));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<SpeciesResponse>> createSpecies(@Valid @RequestBody SpeciesRequest request) {
        SpeciesResponse species = speciesService.createSpecies(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(species, "Species created successfully"));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<SpeciesResponse>> updateSpecies(@PathVariable UUID id,
                                                                      @Valid @RequestBody SpeciesRequest request) {
        SpeciesResponse species = speciesService.updateSpecies(id, request);
        return ResponseEntity.ok(ApiResponse.success(species, Constants.SUCCESS_UPDATED));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Void>> deleteSpecies(@PathVariable UUID id) {
        speciesService.deactivateSpecies(id);
        return ResponseEntity.ok(ApiResponse.success(null, Constants.SUCCESS_DEACTIVATED));
    }
}
