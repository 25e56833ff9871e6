package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.dto.request.StockMovementRequest;
import com.rambopet.clinic_backend.dto.response.PaginatedResponse;
import com.rambopet.clinic_backend.dto.response.StockMovementResponse;
import com.rambopet.clinic_backend.enums.StockMovementType;
import com.rambopet.clinic_backend.exception.ForbiddenException;
import com.rambopet.clinic_backend.exception.InsufficientStockException;
import com.rambopet.clinic_backend.exception.ResourceNotFoundException;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.ClinicalEpisode;
import com.rambopet.clinic_backend.model.Lot;
import com.rambopet.clinic_backend.model.StockMovement;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.repository.ClinicalEpisodeRepository;
import com.rambopet.clinic_backend.repository.LotRepository;
import com.rambopet.clinic_backend.repository.StockMovementRepository;
import com.rambopet.clinic_backend.util.DateUtil;
import com.rambopet.clinic_backend.util.PaginationUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Append-only stock ledger. Recording a movement is the only way lot stock changes after the lot is created.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StockService {

    private final StockMovementRepository stockMovementRepository;
    private final LotRepository lotRepository;
    private final ClinicalEpisodeRepository episodeRepository;
    private final UserService userService;

    @Transactional
    public StockMovementResponse recordMovement(StockMovementRequest request) {
        if (request.getType() == null) {
            throw ValidationException.of("stockMovement", "type", "Movement type is required");
        }

        // Row lock held until commit so concurrent movements on the same lot serialize
        Lot lot = lotRepository.findByIdForUpdate(request.getLotId())
                .orElseThrow(() -> new ResourceNotFoundException("Lot", "id", request.getLotId()));

        StockMovementType type = request.getType();
        int quantity = request.getQuantity();
        int stockBefore = lot.getCurrentStock();
        int stockAfter;
        try {
            stockAfter = type.apply(stockBefore, quantity);
        } catch (ArithmeticException e) {
            log.warn("Rejected {} of {} units on lot {}: stock would overflow", type, quantity, lot.getLotNumber());
            throw ValidationException.of("stockMovement", "quantity", "Quantity is too large for lot " + lot.getLotNumber());
        }

        if (stockAfter < 0) {
            log.warn("Rejected {} of {} units from lot {}: only {} available",
                    type, quantity, lot.getLotNumber(), stockBefore);
            throw new InsufficientStockException(lot.getLotNumber(), stockBefore, quantity);
        }

        ClinicalEpisode episode = null;
        if (request.getEpisodeId() != null) {
            episode = episodeRepository.findById(request.getEpisodeId())
                    .orElseThrow(() -> new ResourceNotFoundException("ClinicalEpisode", "id", request.getEpisodeId()));
        }

        StockMovement movement = StockMovement.builder()
                .lot(lot)
                .type(type)
                .quantity(quantity)
                .stockBefore(stockBefore)
                .stockAfter(stockAfter)
                .episode(episode)
                .reason(request.getReason())
                .referenceDocument(request.getReferenceDocument())
                .performedBy(userService.getCurrentUser())
                .build();

        lot.setCurrentStock(stockAfter);
        lotRepository.save(lot);
        StockMovement saved = stockMovementRepository.save(movement);

        log.info("Stock movement {} on lot {} ({}): {} units, {} -> {}",
                type, lot.getLotNumber(), lot.getProduct().getName(), quantity, stockBefore, stockAfter);
        return mapToStockMovementResponse(saved);
    }

    @Transactional
    public StockMovementResponse recordIntake(StockMovementRequest request) {
        request.setType(StockMovementType.INTAKE);
        return recordMovement(request);
    }

    /**
     * Dispensing shortcut: only sales and clinical use are accepted.
     */
    @Transactional
    public StockMovementResponse recordOutbound(StockMovementRequest request) {
        if (request.getType() == null || !StockMovementType.DISPENSING.contains(request.getType())) {
            throw ValidationException.of("stockMovement", "type", "Outbound movements must be SALE or CLINICAL_USE");
        }
        return recordMovement(request);
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<StockMovementResponse> getMovements(int page, int limit, UUID lotId, UUID productId,
                                                                StockMovementType type,
                                                                LocalDate startDate, LocalDate endDate) {
        Pageable pageable = PaginationUtil.pageOf(page, limit, Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<StockMovement> movements = stockMovementRepository.searchMovements(
                lotId, productId, type,
                startDate != null ? DateUtil.getStartOfDay(startDate) : null,
                endDate != null ? DateUtil.getEndOfDay(endDate) : null,
                pageable);

        log.debug("Found {} stock movements", movements.getTotalElements());
        List<StockMovementResponse> responses = movements.getContent()
                .stream()
                .map(this::mapToStockMovementResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(responses, page, limit, movements.getTotalElements());
    }

    @Transactional(readOnly = true)
    public List<StockMovementResponse> getMovementsByProduct(UUID productId, int limit) {
        return stockMovementRepository.findByProductId(productId, PaginationUtil.firstPage(limit))
                .stream()
                .map(this::mapToStockMovementResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public StockMovementResponse getMovementById(UUID id) {
        return stockMovementRepository.findById(id)
                .map(this::mapToStockMovementResponse)
                .orElseThrow(() -> new ResourceNotFoundException("StockMovement", "id", id));
    }

    public void deleteMovement(UUID id) {
        log.warn("Attempt to delete stock movement {} rejected", id);
        throw new ForbiddenException("Stock movements cannot be deleted. Record a compensating adjustment instead");
    }

    public void updateMovement(UUID id) {
        log.warn("Attempt to modify stock movement {} rejected", id);
        throw new ForbiddenException("Stock movements cannot be modified. Record a compensating adjustment instead");
    }

    public StockMovementResponse mapToStockMovementResponse(StockMovement movement) {
        if (movement == null) return null;

        Lot lot = movement.getLot();
        User performedBy = movement.getPerformedBy();
        return StockMovementResponse.builder()
                .id(movement.getId())
                .lotId(lot.getId())
                .lotNumber(lot.getLotNumber())
                .productId(lot.getProduct().getId())
                .productName(lot.getProduct().getName())
                .type(movement.getType())
                .quantity(movement.getQuantity())
                .stockBefore(movement.getStockBefore())
                .stockAfter(movement.getStockAfter())
                .episodeId(movement.getEpisode() != null ? movement.getEpisode().getId() : null)
                .reason(movement.getReason())
                .referenceDocument(movement.getReferenceDocument())
                .performedById(performedBy != null ? performedBy.getId() : null)
                .performedByName(performedBy != null ? performedBy.getFullName() : null)
                .createdAt(movement.getCreatedAt())
                .build();
    }
}
