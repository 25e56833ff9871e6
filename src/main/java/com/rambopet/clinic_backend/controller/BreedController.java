package com.rambopet.clinic_backend.controller;

import com.rambopet.clinic_backend.dto.request.BreedRequest;
import com.rambopet.clinic_backend.dto.response.ApiResponse;
import com.rambopet.clinic_backend.dto.response.BreedResponse;
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
@RequestMapping("/api/breeds")
@RequiredArgsConstructor
public class BreedController {

    private final SpeciesService speciesService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<BreedResponse>>> getAllBreeds(
            @RequestParam(required = false) UUID speciesId) {
        return ResponseEntity.ok(ApiResponse.success(speciesService.getAllBreeds(speciesId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<BreedResponse>> getBreedById(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(speciesService.getBreedById(id)));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<BreedResponse>> createBreed(@Valid @RequestBody BreedRequest request) {
        BreedResponse breed = speciesService.createBreed(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(breed, "Breed created successfully"));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<BreedResponse>> updateBreed(@PathVariable UUID id,
                                                                  @Valid @RequestBody BreedRequest request) {
        BreedResponse breed = speciesService.updateBreed(id, request);
        return ResponseEntity.ok(ApiResponse.success(breed, Constants.SUCCESS_UPDATED));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Void>> deleteBreed(@PathVariable UUID id) {
        speciesService.deactivateBreed(id);
        return ResponseEntity.ok(ApiResponse.success(null, Constants.SUCCESS_DEACTIVATED));
    }
}
