package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.config.ModelMapperConfig;
import com.rambopet.clinic_backend.dto.request.ProductRequest;
import com.rambopet.clinic_backend.dto.response.ProductResponse;
import com.rambopet.clinic_backend.enums.ProductCategory;
import com.rambopet.clinic_backend.enums.StockLevelStatus;
import com.rambopet.clinic_backend.enums.UnitOfMeasure;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.Product;
import com.rambopet.clinic_backend.repository.ProductRepository;
import com.rambopet.clinic_backend.repository.StockMovementRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProductServiceTest {

    @Mock
    private ProductRepository productRepository;

    @Mock
    private StockMovementRepository stockMovementRepository;

    @Mock
    private StockService stockService;

    private ProductService productService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        productService = new ProductService(productRepository, stockMovementRepository, stockService,
                new ModelMapperConfig().modelMapper());
        when(productRepository.save(any(Product.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void create_normalizesCodeAndKeepsDefaults() {
        ProductResponse response = productService.createProduct(ProductRequest.builder()
                .code(" amx-250 ")
                .name("Amoxicillin 250mg")
                .category(ProductCategory.MEDICINE)
                .unit(UnitOfMeasure.BOX)
                .salePrice(new BigDecimal("45.00"))
                .build());

        assertEquals("AMX-250", response.getCode());
        assertEquals(UnitOfMeasure.BOX, response.getUnit());
        assertEquals(10, response.getMinStock());
        assertEquals(0, response.getTotalStock());
        assertEquals(StockLevelStatus.OUT_OF_STOCK, response.getStockStatus());
        assertTrue(response.isActive());
    }

    @Test
    void create_rejectsDuplicateCodeIgnoringCase() {
        when(productRepository.existsByCodeIgnoreCase("AMX-250")).thenReturn(true);

        ValidationException ex = assertThrows(ValidationException.class, () -> productService.createProduct(
                ProductRequest.builder().code("amx-250").name("Duplicate").category(ProductCategory.MEDICINE).build()));

        assertEquals("code", ex.getFieldErrors().get(0).getField());
        verify(productRepository, never()).save(any());
    }

    @Test
    void update_rejectsMaximumBelowMinimum() {
        Product product = Product.builder().id(UUID.randomUUID()).code("GAU-10").name("Gauze 10cm").build();
        when(productRepository.findById(product.getId())).thenReturn(Optional.of(product));

        ValidationException ex = assertThrows(ValidationException.class, () -> productService.updateProduct(
                product.getId(), ProductRequest.builder()
                        .code("GAU-10")
                        .name("Gauze 10cm")
                        .category(ProductCategory.MEDICAL_SUPPLY)
                        .minStock(50)
                        .maxStock(20)
                        .build()));

        assertEquals("maxStock", ex.getFieldErrors().get(0).getField());
        verify(productRepository, never()).save(any());
    }
}
