package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.dto.response.DashboardSummary;
import com.rambopet.clinic_backend.dto.response.JobRunSummary;
import com.rambopet.clinic_backend.enums.AppointmentStatus;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.exception.ResourceNotFoundException;
import com.rambopet.clinic_backend.repository.AppointmentRepository;
import com.rambopet.clinic_backend.repository.ClinicalEpisodeRepository;
import com.rambopet.clinic_backend.repository.LotRepository;
import com.rambopet.clinic_backend.repository.PatientRepository;
import com.rambopet.clinic_backend.repository.ProductRepository;
import com.rambopet.clinic_backend.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AdminServiceTest {

    private static final ZoneId ZONE = ZoneId.of("America/Mexico_City");

    @Mock
    private UserRepository userRepository;

    @Mock
    private PatientRepository patientRepository;

    @Mock
    private AppointmentRepository appointmentRepository;

    @Mock
    private ClinicalEpisodeRepository episodeRepository;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private LotRepository lotRepository;

    @Mock
    private AppointmentNotificationService appointmentNotificationService;

    @Mock
    private InventoryAlertService inventoryAlertService;

    private AdminService adminService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(LocalDateTime.of(2025, 3, 10, 9, 0).atZone(ZONE).toInstant(), ZONE);
        adminService = new AdminService(userRepository, patientRepository, appointmentRepository, episodeRepository,
                productRepository, lotRepository, appointmentNotificationService, inventoryAlertService, clock);
    }

    @Test
    void dashboard_fillsMissingStatusesWithZero() {
        when(userRepository.countByRoleAndActiveTrue(Role.VETERINARIAN)).thenReturn(3L);
        when(appointmentRepository.countByStatusBetween(any(), any()))
                .thenReturn(Collections.singletonList(new Object[]{AppointmentStatus.CONFIRMED, 4L}));
        when(patientRepository.countByActiveTrue()).thenReturn(57L);
        when(productRepository.findLowStockProducts()).thenReturn(List.of());
        when(lotRepository.countExpiredWithStock(any())).thenReturn(2L);

        DashboardSummary dashboard = adminService.getDashboard();

        assertEquals(3L, dashboard.getActiveUsersByRole().get(Role.VETERINARIAN));
        assertEquals(0L, dashboard.getActiveUsersByRole().get(Role.GUARDIAN));
        assertEquals(4L, dashboard.getTodayAppointmentsByStatus().get(AppointmentStatus.CONFIRMED));
        assertEquals(0L, dashboard.getTodayAppointmentsByStatus().get(AppointmentStatus.BOOKED));
        assertEquals(57, dashboard.getActivePatients());
        assertEquals(2, dashboard.getExpiredLots());
    }

    @Test
    void runJob_dispatchesByName() {
        JobRunSummary summary = JobRunSummary.start(InventoryAlertService.EXPIRY_JOB, LocalDateTime.now());
        when(inventoryAlertService.checkExpiringLots()).thenReturn(summary);

        assertSame(summary, adminService.runJob("expiry-alert"));
        verify(inventoryAlertService).checkExpiringLots();
    }

    @Test
    void runJob_rejectsUnknownName() {
        assertThrows(ResourceNotFoundException.class, () -> adminService.runJob("defrost-freezer"));
        verifyNoInteractions(appointmentNotificationService, inventoryAlertService);
    }
}
