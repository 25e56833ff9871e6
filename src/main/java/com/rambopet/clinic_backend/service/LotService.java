package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.dto.request.LotRequest;
import com.rambopet.clinic_backend.dto.response.LotResponse;
import com.rambopet.clinic_backend.dto.response.PaginatedResponse;
import com.rambopet.clinic_backend.exception.ResourceNotFoundException;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.Lot;
import com.rambopet.clinic_backend.model.Product;
import com.rambopet.clinic_backend.repository.LotRepository;
import com.rambopet.clinic_backend.util.PaginationUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class LotService {

    private final LotRepository lotRepository;
    private final ProductService productService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public PaginatedResponse<LotResponse> getAllLots(int page, int limit, UUID productId, Boolean active,
                                                    LocalDate expiresBefore, String search) {
        Pageable pageable = PaginationUtil.pageOf(page, limit, Sort.by("expiryDate").ascending());
        Page<Lot> lots = lotRepository.searchLots(productId, active, expiresBefore, search, pageable);

        List<LotResponse> responses = lots.getContent()
                .stream()
                .map(this::mapToLotResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(responses, page, limit, lots.getTotalElements());
    }

    @Transactional(readOnly = true)
    public LotResponse getLotById(UUID id) {
        return mapToLotResponse(findLot(id));
    }

    @Transactional
    public LotResponse createLot(LotRequest request) {
        Product product = productService.findProduct(request.getProductId());
        validateDates(request);
        if (lotRepository.existsByProductIdAndLotNumberIgnoreCase(product.getId(), request.getLotNumber().trim())) {
            throw ValidationException.of("lot", "lotNumber", "Lot number already exists for this product");
        }

        Lot lot = Lot.builder()
                .product(product)
                .lotNumber(request.getLotNumber().trim())
                .manufactureDate(request.getManufactureDate())
                .expiryDate(request.getExpiryDate())
                .initialStock(request.getInitialStock())
                .currentStock(request.getInitialStock())
                .purchasePrice(request.getPurchasePrice() != null ? request.getPurchasePrice() : BigDecimal.ZERO)
                .supplier(request.getSupplier())
                .active(request.getActive() == null || request.getActive())
                .build();

        Lot saved = lotRepository.save(lot);
        log.info("Lot {} created for product {} with {} units", saved.getLotNumber(), product.getCode(), saved.getCurrentStock());
        return mapToLotResponse(saved);
    }

    /**
     * Updates descriptive lot data. Initial and current stock are left untouched.
     */
    @Transactional
    public LotResponse updateLot(UUID id, LotRequest request) {
        Lot lot = findLot(id);
        validateDates(request);
        if (!lot.getProduct().getId().equals(request.getProductId())) {
            throw ValidationException.of("lot", "productId", "A lot cannot be moved to another product");
        }
        if (lotRepository.existsByProductIdAndLotNumberIgnoreCaseAndIdNot(
                lot.getProduct().getId(), request.getLotNumber().trim(), id)) {
            throw ValidationException.of("lot", "lotNumber", "Lot number already exists for this product");
        }

        lot.setLotNumber(request.getLotNumber().trim());
        lot.setManufactureDate(request.getManufactureDate());
        lot.setExpiryDate(request.getExpiryDate());
        if (request.getPurchasePrice() != null) {
            lot.setPurchasePrice(request.getPurchasePrice());
        }
        lot.setSupplier(request.getSupplier());
        if (request.getActive() != null) {
            lot.setActive(request.getActive());
        }

        log.info("Lot updated: {}", id);
        return mapToLotResponse(lotRepository.save(lot));
    }

    @Transactional
    public void deactivateLot(UUID id) {
        Lot lot = findLot(id);
        lot.setActive(false);
        lotRepository.save(lot);
        log.info("Lot deactivated: {}", id);
    }

    @Transactional(readOnly = true)
    public List<LotResponse> getExpiredLots() {
        return lotRepository.findExpiredWithStock(LocalDate.now(clock))
                .stream()
                .map(this::mapToLotResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<LotResponse> getExpiringLots(int days) {
        if (days < 0) {
            throw ValidationException.of("lot", "days", "Days must not be negative");
        }
        LocalDate today = LocalDate.now(clock);
        return lotRepository.findExpiringBetween(today, today.plusDays(days))
                .stream()
                .map(this::mapToLotResponse)
                .collect(Collectors.toList());
    }

    public Lot findLot(UUID id) {
        return lotRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Lot", "id", id));
    }

    public LotResponse mapToLotResponse(Lot lot) {
        if (lot == null) return null;

        LocalDate today = LocalDate.now(clock);
        return LotResponse.builder()
                .id(lot.getId())
                .productId(lot.getProduct().getId())
                .productCode(lot.getProduct().getCode())
                .productName(lot.getProduct().getName())
                .lotNumber(lot.getLotNumber())
                .manufactureDate(lot.getManufactureDate())
                .expiryDate(lot.getExpiryDate())
                .initialStock(lot.getInitialStock())
                .currentStock(lot.getCurrentStock())
                .purchasePrice(lot.getPurchasePrice())
                .supplier(lot.getSupplier())
                .active(lot.isActive())
                .expired(lot.isExpired(today))
                .daysToExpiry(lot.daysToExpiry(today))
                .expiringSoon(lot.isExpiringSoon(today))
                .lastExpiryAlertDate(lot.getLastExpiryAlertDate())
                .createdAt(lot.getCreatedAt())
                .updatedAt(lot.getUpdatedAt())
                .build();
    }

    private void validateDates(LotRequest request) {
        if (request.getManufactureDate() != null
                && !request.getExpiryDate().isAfter(request.getManufactureDate())) {
            throw ValidationException.of("lot", "expiryDate", "Expiry date must be after the manufacture date");
        }
    }
}
