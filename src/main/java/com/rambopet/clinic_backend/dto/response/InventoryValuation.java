package com.rambopet.clinic_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryValuation {
    private LocalDate asOf;
    private BigDecimal totalValue;
    private List<Line> lines;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Line {
        private String code;
        private String name;
        private int totalStock;
        private BigDecimal purchasePrice;
        private BigDecimal value;
    }
}
