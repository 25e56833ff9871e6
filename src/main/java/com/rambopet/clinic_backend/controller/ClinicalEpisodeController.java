package com.rambopet.clinic_backend.controller;

import com.rambopet.clinic_backend.dto.request.ClinicalEpisodeRequest;
import com.rambopet.clinic_backend.dto.request.VitalSignsRequest;
import com.rambopet.clinic_backend.dto.response.ApiResponse;
import com.rambopet.clinic_backend.dto.response.AttachmentResponse;
import com.rambopet.clinic_backend.dto.response.ClinicalEpisodeResponse;
import com.rambopet.clinic_backend.dto.response.PaginatedResponse;
import com.rambopet.clinic_backend.dto.response.VitalSignsResponse;
import com.rambopet.clinic_backend.enums.AttachmentType;
import com.rambopet.clinic_backend.service.ClinicalEpisodeService;
import com.rambopet.clinic_backend.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/episodes")
@RequiredArgsConstructor
public class ClinicalEpisodeController {

    private final ClinicalEpisodeService episodeService;

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<ClinicalEpisodeResponse>>> getAllEpisodes(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) UUID patientId,
            @RequestParam(required = false) UUID veterinarianId,
            @RequestParam(required = false) Boolean closed,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String search) {

        PaginatedResponse<ClinicalEpisodeResponse> episodes = episodeService.getAllEpisodes(
                page, limit, patientId, veterinarianId, closed, startDate, endDate, search);
        return ResponseEntity.ok(ApiResponse.success(episodes));
    }

    @GetMapping("/patient/{patientId}")
    public ResponseEntity<ApiResponse<List<ClinicalEpisodeResponse>>> getPatientHistory(@PathVariable UUID patientId) {
        return ResponseEntity.ok(ApiResponse.success(episodeService.getPatientHistory(patientId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ClinicalEpisodeResponse>> getEpisodeById(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(episodeService.getEpisodeById(id)));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN')")
    public ResponseEntity<ApiResponse<ClinicalEpisodeResponse>> createEpisode(
            @Valid @RequestBody ClinicalEpisodeRequest request) {
        ClinicalEpisodeResponse episode = episodeService.createEpisode(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(episode, "Clinical episode created successfully"));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN')")
    public ResponseEntity<ApiResponse<ClinicalEpisodeResponse>> updateEpisode(
            @PathVariable UUID id,
            @Valid @RequestBody ClinicalEpisodeRequest request) {
        ClinicalEpisodeResponse episode = episodeService.updateEpisode(id, request);
        return ResponseEntity.ok(ApiResponse.success(episode, Constants.SUCCESS_UPDATED));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Void>> deleteEpisode(@PathVariable UUID id) {
        episodeService.deleteEpisode(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Clinical episode deleted"));
    }

    @PostMapping("/{id}/close")
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN')")
    public ResponseEntity<ApiResponse<ClinicalEpisodeResponse>> closeEpisode(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(episodeService.closeEpisode(id), "Clinical episode closed"));
    }

    @PostMapping("/{id}/reopen")
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN')")
    public ResponseEntity<ApiResponse<ClinicalEpisodeResponse>> reopenEpisode(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(episodeService.reopenEpisode(id), "Clinical episode reopened"));
    }

    @GetMapping("/{id}/vitals")
    public ResponseEntity<ApiResponse<List<VitalSignsResponse>>> getVitals(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(episodeService.getVitals(id)));
    }

    @PostMapping("/{id}/vitals")
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<VitalSignsResponse>> recordVitals(
            @PathVariable UUID id,
            @Valid @RequestBody VitalSignsRequest request) {
        VitalSignsResponse vitals = episodeService.recordVitals(id, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(vitals, "Vital signs recorded"));
    }

    @GetMapping("/{id}/attachments")
    public ResponseEntity<ApiResponse<List<AttachmentResponse>>> getAttachments(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(episodeService.getAttachments(id)));
    }

    @PostMapping(value = "/{id}/attachments", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<AttachmentResponse>> uploadAttachment(
            @PathVariable UUID id,
            @RequestParam(required = false) AttachmentType type,
            @RequestParam String title,
            @RequestParam(required = false) String description,
            @RequestParam("file") MultipartFile file) {
        AttachmentResponse attachment = episodeService.uploadAttachment(id, type, title, description, file);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(attachment, "Attachment uploaded"));
    }

    @DeleteMapping("/attachments/{attachmentId}")
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<Void>> deleteAttachment(@PathVariable UUID attachmentId) {
        episodeService.deleteAttachment(attachmentId);
        return ResponseEntity.ok(ApiResponse.success(null, "Attachment deleted"));
    }
}
