package com.rambopet.clinic_backend.controller;

import com.rambopet.clinic_backend.dto.request.StockMovementRequest;
import com.rambopet.clinic_backend.dto.response.ApiResponse;
import com.rambopet.clinic_backend.dto.response.PaginatedResponse;
import com.rambopet.clinic_backend.dto.response.StockMovementResponse;
import com.rambopet.clinic_backend.enums.StockMovementType;
import com.rambopet.clinic_backend.service.StockService;
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
@RequestMapping("/api/inventory/movements")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
public class StockMovementController {

    private final StockService stockService;

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<StockMovementResponse>>> getMovements(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) UUID lotId,
            @RequestParam(required = false) UUID productId,
            @RequestParam(required = false) StockMovementType type,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        PaginatedResponse<StockMovementResponse> movements = stockService.getMovements(
                page, limit, lotId, productId, type, startDate, endDate);
        return ResponseEntity.ok(ApiResponse.success(movements));
    }

    @GetMapping("/product/{productId}")
    public ResponseEntity<ApiResponse<List<StockMovementResponse>>> getByProduct(
            @PathVariable UUID productId,
            @RequestParam(defaultValue = "" + Constants.DEFAULT_PRODUCT_MOVEMENTS_LIMIT) int limit) {
        return ResponseEntity.ok(ApiResponse.success(stockService.getMovementsByProduct(productId, limit)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<StockMovementResponse>> getMovementById(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(stockService.getMovementById(id)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<StockMovementResponse>> recordMovement(
            @Valid @RequestBody StockMovementRequest request) {
        StockMovementResponse movement = stockService.recordMovement(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(movement, "Stock movement recorded"));
    }

    @PostMapping("/intake")
    public ResponseEntity<ApiResponse<StockMovementResponse>> recordIntake(
            @Valid @RequestBody StockMovementRequest request) {
        StockMovementResponse movement = stockService.recordIntake(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(movement, "Stock intake recorded"));
    }

    @PostMapping("/outbound")
    public ResponseEntity<ApiResponse<StockMovementResponse>> recordOutbound(
            @Valid @RequestBody StockMovementRequest request) {
        StockMovementResponse movement = stockService.recordOutbound(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(movement, "Stock outbound recorded"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> updateMovement(@PathVariable UUID id) {
        stockService.updateMovement(id);
        return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteMovement(@PathVariable UUID id) {
        stockService.deleteMovement(id);
        return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
    }
}
