package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.dto.request.StockMovementRequest;
import com.rambopet.clinic_backend.dto.response.StockMovementResponse;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.enums.StockMovementType;
import com.rambopet.clinic_backend.exception.ForbiddenException;
import com.rambopet.clinic_backend.exception.InsufficientStockException;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.Lot;
import com.rambopet.clinic_backend.model.Product;
import com.rambopet.clinic_backend.model.StockMovement;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.repository.ClinicalEpisodeRepository;
import com.rambopet.clinic_backend.repository.LotRepository;
import com.rambopet.clinic_backend.repository.StockMovementRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class StockServiceTest {

    @Mock
    private StockMovementRepository stockMovementRepository;

    @Mock
    private LotRepository lotRepository;

    @Mock
    private ClinicalEpisodeRepository episodeRepository;

    @Mock
    private UserService userService;

    @InjectMocks
    private StockService stockService;

    private Lot lot;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        Product product = Product.builder().id(UUID.randomUUID()).code("MEL-15").name("Meloxicam 1.5mg").build();
        lot = Lot.builder()
                .id(UUID.randomUUID())
                .product(product)
                .lotNumber("L-2025-01")
                .expiryDate(LocalDate.of(2026, 1, 31))
                .initialStock(100)
                .currentStock(100)
                .build();

        when(lotRepository.findByIdForUpdate(lot.getId())).thenReturn(Optional.of(lot));
        when(userService.getCurrentUser()).thenReturn(
                User.builder().id(UUID.randomUUID()).username("rita").firstName("Rita").lastName("Diaz")
                        .role(Role.RECEPTIONIST).build());
        when(stockMovementRepository.save(any(StockMovement.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void outbound_recordsBeforeAndAfter_andUpdatesLot() {
        StockMovementResponse response = stockService.recordOutbound(request(StockMovementType.SALE, 30));

        assertEquals(100, response.getStockBefore());
        assertEquals(70, response.getStockAfter());
        assertEquals(70, lot.getCurrentStock());
        verify(lotRepository).save(lot);
    }

    @Test
    void intake_forcesIntakeType() {
        StockMovementRequest request = request(StockMovementType.LOSS, 20);

        StockMovementResponse response = stockService.recordIntake(request);

        assertEquals(StockMovementType.INTAKE, response.getType());
        assertEquals(120, response.getStockAfter());
        assertEquals(120, lot.getCurrentStock());
    }

    @Test
    void outboundBeyondStock_isRejectedAndLeavesLotUntouched() {
        InsufficientStockException ex = assertThrows(InsufficientStockException.class,
                () -> stockService.recordMovement(request(StockMovementType.NEGATIVE_ADJUSTMENT, 101)));

        assertEquals("quantity", ex.getFieldErrors().get(0).getField());
        assertEquals(100, lot.getCurrentStock());
        verify(stockMovementRepository, never()).save(any());
    }

    @ParameterizedTest
    @EnumSource(StockMovementType.class)
    void everyMovementType_movesStockInItsDirection(StockMovementType type) {
        StockMovementResponse response = stockService.recordMovement(request(type, 25));

        int expected = switch (type) {
            case INTAKE, POSITIVE_ADJUSTMENT, RETURN -> 125;
            case SALE, CLINICAL_USE, NEGATIVE_ADJUSTMENT, LOSS -> 75;
        };
        assertEquals(type, response.getType());
        assertEquals(100, response.getStockBefore());
        assertEquals(expected, response.getStockAfter());
        assertEquals(expected, lot.getCurrentStock());
    }

    @Test
    void intakeThatWouldOverflowStock_isAValidationErrorOnQuantity() {
        StockMovementRequest request = request(StockMovementType.INTAKE, Integer.MAX_VALUE);

        ValidationException ex = assertThrows(ValidationException.class, () -> stockService.recordIntake(request));

        assertFalse(ex instanceof InsufficientStockException);
        assertEquals("quantity", ex.getFieldErrors().get(0).getField());
        assertEquals(100, lot.getCurrentStock());
        verify(stockMovementRepository, never()).save(any());
    }

    @Test
    void outboundShortcut_onlyAcceptsDispensingTypes() {
        assertThrows(ValidationException.class,
                () -> stockService.recordOutbound(request(StockMovementType.LOSS, 1)));
        verifyNoInteractions(stockMovementRepository);
    }

    @Test
    void listingFromPageZero_isRejectedBeforeQuerying() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> stockService.getMovements(0, 20, null, null, null, null, null));

        assertEquals("page", ex.getFieldErrors().get(0).getField());
        verifyNoInteractions(stockMovementRepository);
    }

    @Test
    void deletingAMovement_isAlwaysRejected() {
        assertThrows(ForbiddenException.class, () -> stockService.deleteMovement(UUID.randomUUID()));
        verify(stockMovementRepository, never()).delete(any());
        verify(stockMovementRepository, never()).deleteById(any());
    }

    private StockMovementRequest request(StockMovementType type, int quantity) {
        return StockMovementRequest.builder()
                .lotId(lot.getId())
                .type(type)
                .quantity(quantity)
                .reason("test")
                .build();
    }
}
