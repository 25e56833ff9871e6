package com.rambopet.clinic_backend.scheduler;

import com.rambopet.clinic_backend.dto.response.JobRunSummary;
import com.rambopet.clinic_backend.service.AppointmentNotificationService;
import com.rambopet.clinic_backend.service.InventoryAlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Cron triggers for the notification jobs. Disabled with {@code notifications.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "notifications", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class NotificationScheduler {

    private final AppointmentNotificationService appointmentNotificationService;
    private final InventoryAlertService inventoryAlertService;

    @Scheduled(cron = "${notifications.appointment-reminder-cron}", zone = "${clinic.time-zone}")
    public void appointmentReminders() {
        run(AppointmentNotificationService.REMINDERS_JOB, appointmentNotificationService::sendAppointmentReminders);
    }

    @Scheduled(cron = "${notifications.no-show-sweep-cron}", zone = "${clinic.time-zone}")
    public void noShowSweep() {
        run(AppointmentNotificationService.NO_SHOW_JOB, appointmentNotificationService::sweepNoShows);
    }

    @Scheduled(cron = "${notifications.vet-schedule-cron}", zone = "${clinic.time-zone}")
    public void vetDailySchedule() {
        run(AppointmentNotificationService.VET_SCHEDULE_JOB, appointmentNotificationService::sendVetDailySchedules);
    }

    @Scheduled(cron = "${notifications.low-stock-cron}", zone = "${clinic.time-zone}")
    public void lowStockAlert() {
        run(InventoryAlertService.LOW_STOCK_JOB, inventoryAlertService::checkStockLevels);
    }

    @Scheduled(cron = "${notifications.expiry-alert-cron}", zone = "${clinic.time-zone}")
    public void expiryAlert() {
        run(InventoryAlertService.EXPIRY_JOB, inventoryAlertService::checkExpiringLots);
    }

    @Scheduled(cron = "${notifications.valuation-report-cron}", zone = "${clinic.time-zone}")
    public void inventoryValuation() {
        run(InventoryAlertService.VALUATION_JOB, inventoryAlertService::sendMonthlyValuation);
    }

    private void run(String job, Supplier<JobRunSummary> task) {
        try {
            JobRunSummary summary = task.get();
            log.info("Scheduled job {} finished: {}", job, summary);
        } catch (Exception e) {
            log.error("Scheduled job {} failed: {}", job, e.getMessage(), e);
        }
    }
}
