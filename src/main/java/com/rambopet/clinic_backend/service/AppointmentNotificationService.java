package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.config.ClinicProperties;
import com.rambopet.clinic_backend.config.NotificationProperties;
import com.rambopet.clinic_backend.dto.response.JobRunSummary;
import com.rambopet.clinic_backend.enums.AppointmentStatus;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.model.Appointment;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.repository.AppointmentRepository;
import com.rambopet.clinic_backend.repository.UserRepository;
import com.rambopet.clinic_backend.util.DateUtil;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Appointment jobs: reminders, the no-show sweep and the veterinarians' daily agenda.
 * Every item is handled in its own transaction so one failure never undoes the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AppointmentNotificationService {

    public static final String REMINDERS_JOB = "appointment-reminders";
    public static final String NO_SHOW_JOB = "no-show-sweep";
    public static final String VET_SCHEDULE_JOB = "vet-daily-schedule";

    private final AppointmentRepository appointmentRepository;
    private final UserRepository userRepository;
    private final AppointmentService appointmentService;
    private final EmailService emailService;
    private final ClinicProperties clinicProperties;
    private final NotificationProperties notificationProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Emails the guardian of every appointment booked for tomorrow that has not been reminded yet.
     */
    public JobRunSummary sendAppointmentReminders() {
        LocalDateTime now = LocalDateTime.now(clock);
        JobRunSummary summary = JobRunSummary.start(REMINDERS_JOB, now);
        LocalDate tomorrow = now.toLocalDate().plusDays(1);

        List<UUID> candidates = transactionTemplate.execute(status -> appointmentRepository
                .findPendingReminders(DateUtil.getStartOfDay(tomorrow), DateUtil.getStartOfNextDay(tomorrow),
                        AppointmentStatus.PENDING)
                .stream()
                .map(Appointment::getId)
                .collect(Collectors.toList()));
        summary.setCandidates(candidates.size());

        for (UUID id : candidates) {
            ReminderEmail reminder;
            try {
                // Flag committed before sending: a failed commit must not lead to a second email next run
                reminder = transactionTemplate.execute(status -> {
                    Appointment appointment = appointmentService.findAppointment(id);
                    appointment.markReminderSent(LocalDateTime.now(clock));
                    appointmentRepository.save(appointment);
                    return new ReminderEmail(appointment.getGuardian().getEmail(),
                            "Appointment reminder - " + appointment.getPatient().getName(),
                            buildReminderMessage(appointment));
                });
            } catch (Exception e) {
                summary.incrementFailures();
                log.error("Error preparing reminder for appointment {}: {}", id, e.getMessage(), e);
                continue;
            }

            try {
                emailService.sendEmail(reminder.getTo(), reminder.getSubject(), reminder.getBody());
                summary.incrementEmailsSent();
                summary.incrementProcessed();
            } catch (Exception e) {
                summary.incrementFailures();
                log.error("Error sending reminder for appointment {}: {}", id, e.getMessage(), e);
                releaseReminder(id);
            }
        }

        log.info("Appointment reminders: {} candidates, {} sent, {} failed",
                summary.getCandidates(), summary.getEmailsSent(), summary.getFailures());
        return summary;
    }

    /**
     * Marks booked or confirmed appointments whose start passed more than the grace period ago as no-shows.
     */
    public JobRunSummary sweepNoShows() {
        LocalDateTime now = LocalDateTime.now(clock);
        JobRunSummary summary = JobRunSummary.start(NO_SHOW_JOB, now);
        LocalDateTime cutoff = now.minusHours(notificationProperties.getNoShowGraceHours());

        List<UUID> candidates = transactionTemplate.execute(status -> appointmentRepository
                .findByStatusInAndScheduledAtBefore(AppointmentStatus.PENDING, cutoff)
                .stream()
                .map(Appointment::getId)
                .collect(Collectors.toList()));
        summary.setCandidates(candidates.size());

        for (UUID id : candidates) {
            try {
                transactionTemplate.executeWithoutResult(status -> {
                    Appointment appointment = appointmentService.findAppointment(id);
                    appointment.markNoShow();
                    appointmentRepository.save(appointment);
                });
                summary.incrementProcessed();
            } catch (Exception e) {
                summary.incrementFailures();
                log.error("Error marking appointment {} as no-show: {}", id, e.getMessage(), e);
            }
        }

        log.info("No-show sweep: {} appointments marked, {} failed", summary.getProcessed(), summary.getFailures());
        return summary;
    }

    /**
     * Sends each active veterinarian with appointments today their agenda.
     */
    public JobRunSummary sendVetDailySchedules() {
        LocalDateTime now = LocalDateTime.now(clock);
        JobRunSummary summary = JobRunSummary.start(VET_SCHEDULE_JOB, now);
        LocalDate today = now.toLocalDate();

        List<UUID> vets = transactionTemplate.execute(status -> userRepository
                .findByRoleAndActiveTrueOrderByFirstNameAsc(Role.VETERINARIAN)
                .stream()
                .map(User::getId)
                .collect(Collectors.toList()));
        summary.setCandidates(vets.size());

        for (UUID vetId : vets) {
            try {
                Boolean sent = transactionTemplate.execute(status -> {
                    List<Appointment> agenda = appointmentService.findDaySchedule(today, vetId);
                    if (agenda.isEmpty()) {
                        return false;
                    }
                    User vet = agenda.get(0).getVeterinarian();
                    emailService.sendEmail(vet.getEmail(),
                            "Daily schedule - " + DateUtil.formatDate(today),
                            buildScheduleMessage(vet, today, agenda));
                    return true;
                });
                if (Boolean.TRUE.equals(sent)) {
                    summary.incrementEmailsSent();
                    summary.incrementProcessed();
                }
            } catch (Exception e) {
                summary.incrementFailures();
                log.error("Error sending daily schedule to veterinarian {}: {}", vetId, e.getMessage(), e);
            }
        }

        log.info("Veterinarian schedules: {} sent, {} failed", summary.getEmailsSent(), summary.getFailures());
        return summary;
    }

    // Unsent reminders go back to pending so the next run retries them
    private void releaseReminder(UUID id) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                Appointment appointment = appointmentService.findAppointment(id);
                appointment.clearReminderSent();
                appointmentRepository.save(appointment);
            });
        } catch (Exception e) {
            log.error("Reminder for appointment {} was not sent but stays flagged: {}", id, e.getMessage(), e);
        }
    }

    private String buildReminderMessage(Appointment appointment) {
        User vet = appointment.getVeterinarian();
        return "Dear " + appointment.getGuardian().getFullName() + ",\n\n" +
                "This is a reminder of the appointment scheduled for " + appointment.getPatient().getName() + ".\n\n" +
                "Date and time: " + DateUtil.formatDateTime(appointment.getScheduledAt()) + "\n" +
                "Type: " + appointment.getType().getDisplayName() + "\n" +
                "Veterinarian: " + (vet != null ? vet.getFullName() : "To be assigned") + "\n" +
                "Reason: " + appointment.getReason() + "\n\n" +
                "Please arrive 10 minutes early. If you need to cancel or reschedule, contact us as soon as possible.\n\n" +
                clinicProperties.getName() + " Veterinary Clinic";
    }

    private String buildScheduleMessage(User vet, LocalDate day, List<Appointment> agenda) {
        String lines = agenda.stream()
                .map(a -> "- " + DateUtil.formatTime(a.getScheduledAt()) + " - " + a.getPatient().getName() +
                        " (" + a.getGuardian().getFullName() + ") - " + a.getType().getDisplayName())
                .collect(Collectors.joining("\n"));

        return "Dear Dr. " + vet.getFullName() + ",\n\n" +
                "Your schedule for " + DateUtil.formatDate(day) + ":\n\n" +
                lines + "\n\n" +
                "Total appointments: " + agenda.size() + "\n\n" +
                clinicProperties.getName() + " system";
    }

    @Getter
    @AllArgsConstructor
    private static class ReminderEmail {
        private final String to;
        private final String subject;
        private final String body;
    }
}
