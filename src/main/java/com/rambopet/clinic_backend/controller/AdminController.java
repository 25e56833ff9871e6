package com.rambopet.clinic_backend.controller;

import com.rambopet.clinic_backend.dto.response.ApiResponse;
import com.rambopet.clinic_backend.dto.response.DashboardSummary;
import com.rambopet.clinic_backend.dto.response.JobRunSummary;
import com.rambopet.clinic_backend.service.AdminService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {

    private final AdminService adminService;

    @GetMapping("/dashboard")
    public ResponseEntity<ApiResponse<DashboardSummary>> getDashboard() {
        return ResponseEntity.ok(ApiResponse.success(adminService.getDashboard()));
    }

    @PostMapping("/jobs/{job}/run")
    public ResponseEntity<ApiResponse<JobRunSummary>> runJob(@PathVariable String job) {
        JobRunSummary summary = adminService.runJob(job);
        return ResponseEntity.ok(ApiResponse.success(summary, "Job " + job + " finished"));
    }
}
