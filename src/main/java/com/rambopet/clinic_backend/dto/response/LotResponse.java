package com.rambopet.clinic_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotResponse {
    private UUID id;
    private UUID productId;
    private String productCode;
    private String productName;
    private String lotNumber;
    private LocalDate manufactureDate;
    private LocalDate expiryDate;
    private int initialStock;
    private int currentStock;
    private BigDecimal purchasePrice;
    private String supplier;
    private boolean active;
    private boolean expired;
    private long daysToExpiry;
    private boolean expiringSoon;
    private LocalDate lastExpiryAlertDate;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
