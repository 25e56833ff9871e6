package com.rambopet.clinic_backend.dto.response;

import com.rambopet.clinic_backend.enums.StockLevelStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockReportItem {
    private UUID productId;
    private String code;
    private String name;
    private int totalStock;
    private int minStock;
    private int maxStock;
    private StockLevelStatus status;
    private long activeLots;
}
