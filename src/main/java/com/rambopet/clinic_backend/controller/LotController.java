package com.rambopet.clinic_backend.controller;

import com.rambopet.clinic_backend.dto.request.LotRequest;
import com.rambopet.clinic_backend.dto.response.ApiResponse;
import com.rambopet.clinic_backend.dto.response.LotResponse;
import com.rambopet.clinic_backend.dto.response.PaginatedResponse;
import com.rambopet.clinic_backend.service.LotService;
import com.rambopet.clinic_backend.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/inventory/lots")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
public class LotController {

    private final LotService lotService;

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<LotResponse>>> getAllLots(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) UUID productId,
            @RequestParam(required = false) Boolean active,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate expiresBefore,
            @RequestParam(required = false) String search) {

        PaginatedResponse<LotResponse> lots = lotService.getAllLots(page, limit, productId, active, expiresBefore, search);
        return ResponseEntity.ok(ApiResponse.success(lots));
    }

    @GetMapping("/expired")
    public ResponseEntity<ApiResponse<List<LotResponse>>> getExpired() {
        return ResponseEntity.ok(ApiResponse.success(lotService.getExpiredLots()));
    }

    @GetMapping("/expiring")
    public ResponseEntity<ApiResponse<List<LotResponse>>> getExpiring(
            @RequestParam(defaultValue = "" + Constants.DEFAULT_EXPIRING_DAYS) int days) {
        return ResponseEntity.ok(ApiResponse.success(lotService.getExpiringLots(days)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<LotResponse>> getLotById(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(lotService.getLotById(id)));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<LotResponse>> createLot(@Valid @RequestBody LotRequest request) {
        LotResponse lot = lotService.createLot(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(lot, "Lot created successfully"));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<LotResponse>> updateLot(@PathVariable UUID id,
                                                              @Valid @RequestBody LotRequest request) {
        LotResponse lot = lotService.updateLot(id, request);
        return ResponseEntity.ok(ApiResponse.success(lot, Constants.SUCCESS_UPDATED));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Void>> deleteLot(@PathVariable UUID id) {
        lotService.deactivateLot(id);
        return ResponseEntity.ok(ApiResponse.success(null, Constants.SUCCESS_DEACTIVATED));
    }
}
