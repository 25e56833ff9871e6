package com.rambopet.clinic_backend.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * The initial stock is only read on creation; afterwards stock changes go through movements.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotRequest {

    @NotNull(message = "Product is required")
    private UUID productId;

    @NotBlank(message = "Lot number is required")
    @Size(max = 100)
    private String lotNumber;

    private LocalDate manufactureDate;

    @NotNull(message = "Expiry date is required")
    private LocalDate expiryDate;

    @NotNull(message = "Initial stock is required")
    @Min(value = 0, message = "Initial stock must not be negative")
    private Integer initialStock;

    @DecimalMin(value = "0.00", message = "Purchase price must not be negative")
    private BigDecimal purchasePrice;

    @Size(max = 200)
    private String supplier;

    private Boolean active;
}
