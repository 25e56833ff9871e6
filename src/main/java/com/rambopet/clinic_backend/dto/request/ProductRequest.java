package com.rambopet.clinic_backend.dto.request;

import com.rambopet.clinic_backend.enums.ProductCategory;
import com.rambopet.clinic_backend.enums.UnitOfMeasure;
import jakarta.validation.constraints.AssertTrue;
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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductRequest {

    @NotBlank(message = "Product code is required")
    @Size(max = 50)
    private String code;

    @NotBlank(message = "Product name is required")
    @Size(max = 200)
    private String name;

    private String description;

    @NotNull(message = "Category is required")
    private ProductCategory category;

    @Size(max = 200)
    private String activeIngredient;

    @Size(max = 100)
    private String concentration;

    @Size(max = 200)
    private String manufacturer;

    private UnitOfMeasure unit;

    @Min(value = 0, message = "Minimum stock must not be negative")
    private Integer minStock;

    @Min(value = 0, message = "Maximum stock must not be negative")
    private Integer maxStock;

    @DecimalMin(value = "0.00", message = "Purchase price must not be negative")
    private BigDecimal purchasePrice;

    @DecimalMin(value = "0.00", message = "Sale price must not be negative")
    private BigDecimal salePrice;

    private Boolean prescriptionRequired;

    private Boolean lotTracked;

    private Boolean active;

    @AssertTrue(message = "Maximum stock must be greater than or equal to minimum stock")
    public boolean isStockRangeValid() {
        return minStock == null || maxStock == null || maxStock >= minStock;
    }
}
