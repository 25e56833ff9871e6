package com.rambopet.clinic_backend.controller;

import com.rambopet.clinic_backend.dto.request.ProductRequest;
import com.rambopet.clinic_backend.dto.response.ApiResponse;
import com.rambopet.clinic_backend.dto.response.PaginatedResponse;
import com.rambopet.clinic_backend.dto.response.ProductResponse;
import com.rambopet.clinic_backend.dto.response.StockMovementResponse;
import com.rambopet.clinic_backend.dto.response.StockReportItem;
import com.rambopet.clinic_backend.enums.ProductCategory;
import com.rambopet.clinic_backend.service.ProductService;
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
@RequestMapping("/api/inventory/products")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('ADMIN', 'VETERINARIAN', 'RECEPTIONIST')")
public class ProductController {

    private final ProductService productService;

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<ProductResponse>>> getAllProducts(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) ProductCategory category,
            @RequestParam(required = false) Boolean active,
            @RequestParam(required = false) Boolean prescriptionRequired) {

        PaginatedResponse<ProductResponse> products = productService.getAllProducts(
                page, limit, search, category, active, prescriptionRequired);
        return ResponseEntity.ok(ApiResponse.success(products));
    }

    @GetMapping("/low-stock")
    public ResponseEntity<ApiResponse<List<ProductResponse>>> getLowStock() {
        return ResponseEntity.ok(ApiResponse.success(productService.getLowStockProducts()));
    }

    @GetMapping("/stock-report")
    public ResponseEntity<ApiResponse<List<StockReportItem>>> getStockReport() {
        return ResponseEntity.ok(ApiResponse.success(productService.getStockReport()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ProductResponse>> getProductById(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(productService.getProductById(id)));
    }

    @GetMapping("/{id}/movements")
    public ResponseEntity<ApiResponse<List<StockMovementResponse>>> getMovementHistory(
            @PathVariable UUID id,
            @RequestParam(defaultValue = "" + Constants.DEFAULT_MOVEMENT_HISTORY_LIMIT) int limit) {
        return ResponseEntity.ok(ApiResponse.success(productService.getMovementHistory(id, limit)));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<ProductResponse>> createProduct(@Valid @RequestBody ProductRequest request) {
        ProductResponse product = productService.createProduct(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(product, "Product created successfully"));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'RECEPTIONIST')")
    public ResponseEntity<ApiResponse<ProductResponse>> updateProduct(@PathVariable UUID id,
                                                                      @Valid @RequestBody ProductRequest request) {
        ProductResponse product = productService.updateProduct(id, request);
        return ResponseEntity.ok(ApiResponse.success(product, Constants.SUCCESS_UPDATED));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Void>> deleteProduct(@PathVariable UUID id) {
        productService.deactivateProduct(id);
        return ResponseEntity.ok(ApiResponse.success(null, Constants.SUCCESS_DEACTIVATED));
    }
}
