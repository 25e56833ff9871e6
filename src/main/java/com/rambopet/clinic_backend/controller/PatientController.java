package com.rambopet.clinic_backend.controller;

import com.rambopet.clinic_backend.dto.request.DeceasedRequest;
import com.rambopet.clinic_backend.dto.request.PatientRequest;
import com.rambopet.clinic_backend.dto.request.WeightUpdateRequest;
import com.rambopet.clinic_backend.dto.response.ApiResponse;
import com.rambopet.clinic_backend.dto.response.PaginatedResponse;
import com.rambopet.clinic_backend.dto.response.PatientResponse;
import com.rambopet.clinic_backend.enums.Sex;
import com.rambopet.clinic_backend.service.PatientService;
import com.rambopet.clinic_backend.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/patients")
@RequiredArgsConstructor
public class PatientController {

    private final PatientService patientService;

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<PatientResponse>>> getAllPatients(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) UUID guardianId,
            @RequestParam(required = false) UUID speciesId,
            @RequestParam(required = false) Sex sex,
            @RequestParam(required = false) Boolean active,
            @RequestParam(required = false) Boolean deceased,
            @RequestParam(required = false) String search) {

        PaginatedResponse<PatientResponse> patients = patientService.getAllPatients(
                page, limit, guardianId, speciesId, sex, active, deceased, search);
        return ResponseEntity.ok(ApiResponse.success(patients));
    }

    @GetMapping("/mine")
    @PreAuthorize("hasRole('GUARDIAN')")
    public ResponseEntity<ApiResponse<List<PatientResponse>>> getMyPatients() {
        return ResponseEntity.ok(ApiResponse.success(patientService.getMyPatients()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<PatientResponse>> getPatientById(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(patientService.getPatientById(id)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<PatientResponse>> createPatient(@Valid @RequestBody PatientRequest request) {
        PatientResponse patient = patientService.createPatient(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(patient, "Patient registered successfully"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<PatientResponse>> updatePatient(@PathVariable UUID id,
                                                                      @Valid @RequestBody PatientRequest request) {
        PatientResponse patient = patientService.updatePatient(id, request);
        return ResponseEntity.ok(ApiResponse.success(patient, Constants.SUCCESS_UPDATED));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<Void>> deletePatient(@PathVariable UUID id) {
        patientService.deactivatePatient(id);
        return ResponseEntity.ok(ApiResponse.success(null, Constants.SUCCESS_DEACTIVATED));
    }

    @PostMapping("/{id}/deceased")
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<PatientResponse>> markDeceased(@PathVariable UUID id,
                                                                     @RequestBody DeceasedRequest request) {
        PatientResponse patient = patientService.markDeceased(id, request.getDateOfDeath());
        return ResponseEntity.ok(ApiResponse.success(patient, "Patient marked as deceased"));
    }

    @PostMapping("/{id}/weight")
    public ResponseEntity<ApiResponse<PatientResponse>> updateWeight(@PathVariable UUID id,
                                                                     @Valid @RequestBody WeightUpdateRequest request) {
        PatientResponse patient = patientService.updateWeight(id, request.getWeight());
        return ResponseEntity.ok(ApiResponse.success(patient, "Weight updated successfully"));
    }

    @PostMapping(value = "/{id}/photo", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<PatientResponse>> uploadPhoto(@PathVariable UUID id,
                                                                    @RequestParam("file") MultipartFile file) {
        PatientResponse patient = patientService.uploadPhoto(id, file);
        return ResponseEntity.ok(ApiResponse.success(patient, Constants.SUCCESS_UPDATED));
    }
}
