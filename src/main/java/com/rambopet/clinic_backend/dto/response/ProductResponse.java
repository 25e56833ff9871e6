package com.rambopet.clinic_backend.dto.response;

import com.rambopet.clinic_backend.enums.ProductCategory;
import com.rambopet.clinic_backend.enums.StockLevelStatus;
import com.rambopet.clinic_backend.enums.UnitOfMeasure;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {
    private UUID id;
    private String code;
    private String name;
    private String description;
    private ProductCategory category;
    private String activeIngredient;
    private String concentration;
    private String manufacturer;
    private UnitOfMeasure unit;
    private int minStock;
    private int maxStock;
    private BigDecimal purchasePrice;
    private BigDecimal salePrice;
    private boolean prescriptionRequired;
    private boolean lotTracked;
    private boolean active;
    private int totalStock;
    private boolean lowStock;
    private StockLevelStatus stockStatus;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
