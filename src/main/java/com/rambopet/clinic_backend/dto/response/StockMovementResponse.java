package com.rambopet.clinic_backend.dto.response;

import com.rambopet.clinic_backend.enums.StockMovementType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockMovementResponse {
    private UUID id;
    private UUID lotId;
    private String lotNumber;
    private UUID productId;
    private String productName;
    private StockMovementType type;
    private int quantity;
    private int stockBefore;
    private int stockAfter;
    private UUID episodeId;
    private String reason;
    private String referenceDocument;
    private UUID performedById;
    private String performedByName;
    private LocalDateTime createdAt;
}
