package com.rambopet.clinic_backend.model;

import com.rambopet.clinic_backend.enums.ProductCategory;
import com.rambopet.clinic_backend.enums.StockLevelStatus;
import com.rambopet.clinic_backend.enums.UnitOfMeasure;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "products", indexes = {
        @Index(name = "idx_products_code", columnList = "code"),
        @Index(name = "idx_products_category_active", columnList = "category, is_active")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true, length = 50)
    private String code;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ProductCategory category = ProductCategory.OTHER;

    @Column(length = 200)
    private String activeIngredient;

    @Column(length = 100)
    private String concentration;

    @Column(length = 200)
    private String manufacturer;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private UnitOfMeasure unit = UnitOfMeasure.UNIT;

    @Builder.Default
    private int minStock = 10;

    @Builder.Default
    private int maxStock = 100;

    @Column(precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal purchasePrice = BigDecimal.ZERO;

    @Column(precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal salePrice = BigDecimal.ZERO;

    @Builder.Default
    private boolean prescriptionRequired = false;

    @Builder.Default
    private boolean lotTracked = true;

    @Column(name = "is_active")
    @Builder.Default
    private boolean active = true;

    @OneToMany(mappedBy = "product")
    @Builder.Default
    private List<Lot> lots = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Sum of the current stock of every active lot.
     */
    public int getTotalStock() {
        return lots.stream()
                .filter(Lot::isActive)
                .mapToInt(Lot::getCurrentStock)
                .sum();
    }

    public boolean isLowStock() {
        return getTotalStock() < minStock;
    }

    public StockLevelStatus getStockLevelStatus() {
        return StockLevelStatus.of(getTotalStock(), minStock, maxStock);
    }

    public long getActiveLotCount() {
        return lots.stream().filter(Lot::isActive).count();
    }

    @Override
    public String toString() {
        return "Product{" +
                "id=" + id +
                ", code='" + code + '\'' +
                ", name='" + name + '\'' +
                ", category=" + category +
                ", active=" + active +
                '}';
    }
}
