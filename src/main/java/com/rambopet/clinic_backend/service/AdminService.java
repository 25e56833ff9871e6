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
import com.rambopet.clinic_backend.util.DateUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class AdminService {

    private final UserRepository userRepository;
    private final PatientRepository patientRepository;
    private final AppointmentRepository appointmentRepository;
    private final ClinicalEpisodeRepository episodeRepository;
    private final ProductRepository productRepository;
    private final LotRepository lotRepository;
    private final AppointmentNotificationService appointmentNotificationService;
    private final InventoryAlertService inventoryAlertService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DashboardSummary getDashboard() {
        LocalDate today = LocalDate.now(clock);

        Map<Role, Long> usersByRole = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            usersByRole.put(role, userRepository.countByRoleAndActiveTrue(role));
        }

        Map<AppointmentStatus, Long> appointmentsByStatus = new EnumMap<>(AppointmentStatus.class);
        for (AppointmentStatus status : AppointmentStatus.values()) {
            appointmentsByStatus.put(status, 0L);
        }
        for (Object[] row : appointmentRepository.countByStatusBetween(
                DateUtil.getStartOfDay(today), DateUtil.getStartOfNextDay(today))) {
            appointmentsByStatus.put((AppointmentStatus) row[0], (Long) row[1]);
        }

        return DashboardSummary.builder()
                .date(today)
                .activeUsersByRole(usersByRole)
                .activePatients(patientRepository.countByActiveTrue())
                .todayAppointmentsByStatus(appointmentsByStatus)
                .openEpisodes(episodeRepository.countByClosedFalse())
                .lowStockProducts(productRepository.findLowStockProducts().size())
                .expiredLots(lotRepository.countExpiredWithStock(today))
                .build();
    }

    /**
     * Runs a notification job immediately, regardless of its schedule.
     */
    public JobRunSummary runJob(String job) {
        log.info("Running job '{}' on demand", job);
        switch (job) {
            case AppointmentNotificationService.REMINDERS_JOB:
                return appointmentNotificationService.sendAppointmentReminders();
            case AppointmentNotificationService.NO_SHOW_JOB:
                return appointmentNotificationService.sweepNoShows();
            case AppointmentNotificationService.VET_SCHEDULE_JOB:
                return appointmentNotificationService.sendVetDailySchedules();
            case InventoryAlertService.LOW_STOCK_JOB:
                return inventoryAlertService.checkStockLevels();
            case InventoryAlertService.EXPIRY_JOB:
                return inventoryAlertService.checkExpiringLots();
            case InventoryAlertService.VALUATION_JOB:
                return inventoryAlertService.sendMonthlyValuation();
            default:
                throw new ResourceNotFoundException("Job", "name", job);
        }
    }
}
