package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.dto.request.LotRequest;
import com.rambopet.clinic_backend.dto.response.LotResponse;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.Lot;
import com.rambopet.clinic_backend.model.Product;
import com.rambopet.clinic_backend.repository.LotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LotServiceTest {

    private static final ZoneId ZONE = ZoneId.of("America/Mexico_City");
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    @Mock
    private LotRepository lotRepository;

    @Mock
    private ProductService productService;

    private LotService lotService;

    private Product product;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(TODAY.atStartOfDay(ZONE).plusHours(9).toInstant(), ZONE);
        lotService = new LotService(lotRepository, productService, clock);

        product = Product.builder().id(UUID.randomUUID()).code("VAC-RAB").name("Rabies vaccine").build();
        when(productService.findProduct(product.getId())).thenReturn(product);
        when(lotRepository.save(any(Lot.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void create_startsCurrentStockAtInitialStock() {
        LotResponse response = lotService.createLot(LotRequest.builder()
                .productId(product.getId())
                .lotNumber(" R-2025-07 ")
                .manufactureDate(TODAY.minusMonths(2))
                .expiryDate(TODAY.plusDays(20))
                .initialStock(24)
                .build());

        assertEquals("R-2025-07", response.getLotNumber());
        assertEquals(24, response.getCurrentStock());
        assertEquals(24, response.getInitialStock());
        assertTrue(response.isExpiringSoon());
        assertFalse(response.isExpired());
    }

    @Test
    void create_rejectsExpiryNotAfterManufacture() {
        ValidationException ex = assertThrows(ValidationException.class, () -> lotService.createLot(LotRequest.builder()
                .productId(product.getId())
                .lotNumber("R-BAD")
                .manufactureDate(TODAY)
                .expiryDate(TODAY)
                .initialStock(5)
                .build()));

        assertEquals("expiryDate", ex.getFieldErrors().get(0).getField());
        verify(lotRepository, never()).save(any());
    }

    @Test
    void create_rejectsRepeatedLotNumberForSameProduct() {
        when(lotRepository.existsByProductIdAndLotNumberIgnoreCase(product.getId(), "R-1")).thenReturn(true);

        assertThrows(ValidationException.class, () -> lotService.createLot(LotRequest.builder()
                .productId(product.getId())
                .lotNumber("R-1")
                .expiryDate(TODAY.plusYears(1))
                .initialStock(5)
                .build()));
    }

    @Test
    void update_leavesStockAndProductAlone() {
        Lot lot = Lot.builder()
                .id(UUID.randomUUID())
                .product(product)
                .lotNumber("R-2")
                .expiryDate(TODAY.plusYears(1))
                .initialStock(30)
                .currentStock(12)
                .build();
        when(lotRepository.findById(lot.getId())).thenReturn(Optional.of(lot));

        LotResponse response = lotService.updateLot(lot.getId(), LotRequest.builder()
                .productId(product.getId())
                .lotNumber("R-2B")
                .expiryDate(TODAY.plusYears(2))
                .initialStock(999)
                .supplier("Vet Supplies SA")
                .build());

        assertEquals("R-2B", response.getLotNumber());
        assertEquals(12, response.getCurrentStock());
        assertEquals(30, response.getInitialStock());

        assertThrows(ValidationException.class, () -> lotService.updateLot(lot.getId(), LotRequest.builder()
                .productId(UUID.randomUUID())
                .lotNumber("R-2B")
                .expiryDate(TODAY.plusYears(2))
                .initialStock(30)
                .build()));
    }
}
