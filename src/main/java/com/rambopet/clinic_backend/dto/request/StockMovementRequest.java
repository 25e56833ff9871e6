package com.rambopet.clinic_backend.dto.request;

import com.rambopet.clinic_backend.enums.StockMovementType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockMovementRequest {

    @NotNull(message = "Lot is required")
    private UUID lotId;

    // Set by the intake endpoint; required elsewhere
    private StockMovementType type;

    @NotNull(message = "Quantity is required")
    @Min(value = 1, message = "Quantity must be greater than zero")
    private Integer quantity;

    private UUID episodeId;

    private String reason;

    @Size(max = 100)
    private String referenceDocument;
}
