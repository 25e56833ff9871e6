package com.rambopet.clinic_backend.controller;

import com.rambopet.clinic_backend.dto.request.AppointmentRequest;
import com.rambopet.clinic_backend.dto.request.CancelAppointmentRequest;
import com.rambopet.clinic_backend.dto.response.ApiResponse;
import com.rambopet.clinic_backend.dto.response.AppointmentResponse;
import com.rambopet.clinic_backend.dto.response.PaginatedResponse;
import com.rambopet.clinic_backend.enums.AppointmentStatus;
import com.rambopet.clinic_backend.enums.AppointmentType;
import com.rambopet.clinic_backend.exception.ForbiddenException;
import com.rambopet.clinic_backend.service.AppointmentService;
import com.rambopet.clinic_backend.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/appointments")
@RequiredArgsConstructor
@Slf4j
public class AppointmentController {

    private final AppointmentService appointmentService;

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<AppointmentResponse>>> getAllAppointments(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) UUID patientId,
            @RequestParam(required = false) UUID guardianId,
            @RequestParam(required = false) UUID veterinarianId,
            @RequestParam(required = false) AppointmentStatus status,
            @RequestParam(required = false) AppointmentType type,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String search) {

        PaginatedResponse<AppointmentResponse> appointments = appointmentService.getAllAppointments(
                page, limit, patientId, guardianId, veterinarianId, status, type, startDate, endDate, search);
        return ResponseEntity.ok(ApiResponse.success(appointments));
    }

    @GetMapping("/mine")
    public ResponseEntity<ApiResponse<List<AppointmentResponse>>> getMyAppointments(
            @RequestParam(required = false) AppointmentStatus status) {
        return ResponseEntity.ok(ApiResponse.success(appointmentService.getMyAppointments(status)));
    }

    @GetMapping("/schedule")
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<List<AppointmentResponse>>> getSchedule(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) UUID veterinarianId) {
        return ResponseEntity.ok(ApiResponse.success(appointmentService.getVetSchedule(date, veterinarianId)));
    }

    @GetMapping("/upcoming")
    public ResponseEntity<ApiResponse<List<AppointmentResponse>>> getUpcoming(
            @RequestParam(defaultValue = "" + Constants.DEFAULT_UPCOMING_DAYS) int days) {
        return ResponseEntity.ok(ApiResponse.success(appointmentService.getUpcomingAppointments(days)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<AppointmentResponse>> getAppointmentById(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(appointmentService.getAppointmentById(id)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<AppointmentResponse>> createAppointment(
            @Valid @RequestBody AppointmentRequest request) {
        AppointmentResponse appointment = appointmentService.createAppointment(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(appointment, "Appointment booked successfully"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<AppointmentResponse>> updateAppointment(
            @PathVariable UUID id,
            @Valid @RequestBody AppointmentRequest request) {
        AppointmentResponse appointment = appointmentService.updateAppointment(id, request);
        return ResponseEntity.ok(ApiResponse.success(appointment, Constants.SUCCESS_UPDATED));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteAppointment(@PathVariable UUID id) {
        log.warn("Attempt to delete appointment {} rejected", id);
        throw new ForbiddenException("Appointments cannot be deleted. Use the cancel action instead");
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<ApiResponse<AppointmentResponse>> confirm(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(appointmentService.confirm(id), "Appointment confirmed"));
    }

    @PostMapping("/{id}/start")
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<AppointmentResponse>> start(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(appointmentService.start(id), "Appointment started"));
    }

    @PostMapping("/{id}/complete")
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<AppointmentResponse>> complete(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(appointmentService.complete(id), "Appointment completed"));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<AppointmentResponse>> cancel(
            @PathVariable UUID id,
            @RequestBody(required = false) CancelAppointmentRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(ApiResponse.success(appointmentService.cancel(id, reason), "Appointment cancelled"));
    }

    @PostMapping("/{id}/no-show")
    @PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<AppointmentResponse>> markNoShow(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(appointmentService.markNoShow(id), "Appointment marked as no-show"));
    }
}
