package com.rambopet.clinic_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

@Entity
@Table(name = "lots",
        uniqueConstraints = @UniqueConstraint(name = "uk_lot_product_number", columnNames = {"product_id", "lot_number"}),
        indexes = {
                @Index(name = "idx_lots_product_expiry", columnList = "product_id, expiry_date"),
                @Index(name = "idx_lots_expiry_active", columnList = "expiry_date, is_active")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Lot {

    public static final int EXPIRING_SOON_DAYS = 30;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    @Column(name = "lot_number", nullable = false, length = 100)
    private String lotNumber;

    private LocalDate manufactureDate;

    @Column(name = "expiry_date", nullable = false)
    private LocalDate expiryDate;

    @Column(nullable = false)
    private int initialStock;

    // Written only through stock movements once the lot exists
    @Column(nullable = false)
    private int currentStock;

    @Column(precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal purchasePrice = BigDecimal.ZERO;

    @Column(length = 200)
    private String supplier;

    @Column(name = "is_active")
    @Builder.Default
    private boolean active = true;

    private LocalDate lastExpiryAlertDate;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isExpired(LocalDate today) {
        return expiryDate.isBefore(today);
    }

    public long daysToExpiry(LocalDate today) {
        return ChronoUnit.DAYS.between(today, expiryDate);
    }

    public boolean isExpiringSoon(LocalDate today) {
        long days = daysToExpiry(today);
        return days >= 0 && days <= EXPIRING_SOON_DAYS;
    }
}
