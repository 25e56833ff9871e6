package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.config.ClinicProperties;
import com.rambopet.clinic_backend.config.NotificationProperties;
import com.rambopet.clinic_backend.dto.response.InventoryValuation;
import com.rambopet.clinic_backend.dto.response.JobRunSummary;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.model.Lot;
import com.rambopet.clinic_backend.model.Product;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.repository.LotRepository;
import com.rambopet.clinic_backend.repository.ProductRepository;
import com.rambopet.clinic_backend.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class InventoryAlertServiceTest {

    private static final ZoneId ZONE = ZoneId.of("America/Mexico_City");
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    @Mock
    private ProductRepository productRepository;

    @Mock
    private LotRepository lotRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private EmailService emailService;

    private InventoryAlertService alertService;

    private Product amoxicillin;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(LocalDateTime.of(TODAY, LocalTime.of(8, 0)).atZone(ZONE).toInstant(), ZONE);
        TransactionTemplate transactionTemplate = new TransactionTemplate(mock(PlatformTransactionManager.class));
        alertService = new InventoryAlertService(productRepository, lotRepository, userRepository, emailService,
                new ClinicProperties(), new NotificationProperties(), transactionTemplate, clock);

        amoxicillin = Product.builder()
                .id(UUID.randomUUID())
                .code("AMX-250")
                .name("Amoxicillin 250mg")
                .minStock(10)
                .purchasePrice(new BigDecimal("12.50"))
                .build();

        when(userRepository.findByRoleInAndActiveTrue(any())).thenReturn(List.of(
                User.builder().email("admin@rambopet.com").role(Role.ADMIN).build(),
                User.builder().email("front@rambopet.com").role(Role.RECEPTIONIST).build()));
    }

    @Test
    void lowStockProduct_isReportedToStaff() {
        amoxicillin.getLots().add(lot("A-1", 5, TODAY.plusYears(1)));
        when(productRepository.findLowStockProducts()).thenReturn(List.of(amoxicillin));

        JobRunSummary summary = alertService.checkStockLevels();

        assertEquals(1, summary.getCandidates());
        assertEquals(2, summary.getEmailsSent());
        verify(emailService).sendEmail(eq("admin@rambopet.com"), anyString(), contains("current stock 5, minimum 10"));
        verify(emailService).sendEmail(eq("front@rambopet.com"), anyString(), contains("AMX-250"));
    }

    @Test
    void noLowStock_sendsNothing() {
        when(productRepository.findLowStockProducts()).thenReturn(List.of());

        JobRunSummary summary = alertService.checkStockLevels();

        assertEquals(0, summary.getCandidates());
        verifyNoInteractions(emailService);
    }

    @Test
    void expiryAlert_isSentOncePerDay() {
        Lot expiring = lot("A-2", 8, TODAY.plusDays(12));
        Lot expired = lot("A-0", 3, TODAY.minusDays(2));
        List<Lot> lots = List.of(expiring, expired);

        // Behaves like the query: skips lots already alerted today
        when(lotRepository.findPendingExpiryAlerts(eq(TODAY), any(LocalDate.class))).thenAnswer(invocation -> lots.stream()
                .filter(lot -> !TODAY.equals(lot.getLastExpiryAlertDate()))
                .collect(Collectors.toList()));
        when(lotRepository.findAllById(any())).thenAnswer(invocation -> {
            Collection<UUID> ids = invocation.getArgument(0);
            return lots.stream().filter(lot -> ids.contains(lot.getId())).collect(Collectors.toList());
        });

        JobRunSummary first = alertService.checkExpiringLots();

        assertEquals(2, first.getCandidates());
        assertEquals(2, first.getEmailsSent());
        assertEquals(TODAY, expiring.getLastExpiryAlertDate());
        assertEquals(TODAY, expired.getLastExpiryAlertDate());
        verify(emailService).sendEmail(eq("admin@rambopet.com"), anyString(), contains("EXPIRED LOTS WITH STOCK (1)"));

        JobRunSummary second = alertService.checkExpiringLots();

        assertEquals(0, second.getCandidates());
        assertEquals(0, second.getEmailsSent());
        verify(emailService, times(2)).sendEmail(anyString(), anyString(), anyString());
    }

    @Test
    void expiryAlert_leavesLotsUnstampedWhenEveryEmailFails() {
        Lot expiring = lot("A-3", 4, TODAY.plusDays(5));
        when(lotRepository.findPendingExpiryAlerts(eq(TODAY), any(LocalDate.class))).thenReturn(List.of(expiring));
        doThrow(new RuntimeException("SMTP down")).when(emailService).sendEmail(anyString(), anyString(), anyString());

        JobRunSummary summary = alertService.checkExpiringLots();

        assertEquals(2, summary.getFailures());
        assertNull(expiring.getLastExpiryAlertDate());
        verify(lotRepository, never()).save(any(Lot.class));
    }

    @Test
    void valuation_multipliesActiveStockByPurchasePrice() {
        amoxicillin.getLots().add(lot("A-4", 20, TODAY.plusYears(1)));
        Lot inactive = lot("A-5", 50, TODAY.plusYears(1));
        inactive.setActive(false);
        amoxicillin.getLots().add(inactive);
        when(productRepository.findByActiveTrueOrderByNameAsc()).thenReturn(List.of(amoxicillin));

        InventoryValuation valuation = alertService.calculateValuation(TODAY);

        assertEquals(1, valuation.getLines().size());
        assertEquals(20, valuation.getLines().get(0).getTotalStock());
        assertEquals(0, new BigDecimal("250.00").compareTo(valuation.getTotalValue()));
    }

    private Lot lot(String number, int stock, LocalDate expiry) {
        return Lot.builder()
                .id(UUID.randomUUID())
                .product(amoxicillin)
                .lotNumber(number)
                .expiryDate(expiry)
                .initialStock(stock)
                .currentStock(stock)
                .build();
    }
}
