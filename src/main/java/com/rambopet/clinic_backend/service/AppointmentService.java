package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.dto.request.AppointmentRequest;
import com.rambopet.clinic_backend.dto.response.AppointmentResponse;
import com.rambopet.clinic_backend.dto.response.PaginatedResponse;
import com.rambopet.clinic_backend.enums.AppointmentStatus;
import com.rambopet.clinic_backend.enums.AppointmentType;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.exception.ForbiddenException;
import com.rambopet.clinic_backend.exception.InvalidStateTransitionException;
import com.rambopet.clinic_backend.exception.ResourceNotFoundException;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.Appointment;
import com.rambopet.clinic_backend.model.Patient;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.repository.AppointmentRepository;
import com.rambopet.clinic_backend.util.DateUtil;
import com.rambopet.clinic_backend.util.PaginationUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AppointmentService {

    private final AppointmentRepository appointmentRepository;
    private final PatientService patientService;
    private final UserService userService;
    private final Clock clock;

    @Transactional
    public AppointmentResponse createAppointment(AppointmentRequest request) {
        User currentUser = userService.getCurrentUser();
        LocalDateTime now = LocalDateTime.now(clock);

        if (request.getScheduledAt().isBefore(now)) {
            throw ValidationException.of("appointment", "scheduledAt", "Appointments cannot be booked in the past");
        }

        Appointment appointment = new Appointment();
        applyRequest(appointment, request, currentUser);
        appointment.setStatus(AppointmentStatus.BOOKED);
        appointment.setCreatedBy(currentUser);

        Appointment saved = appointmentRepository.save(appointment);
        log.info("Appointment {} booked for patient {} at {}", saved.getId(),
                saved.getPatient().getName(), saved.getScheduledAt());
        return mapToAppointmentResponse(saved, currentUser);
    }

    @Transactional
    public AppointmentResponse updateAppointment(UUID id, AppointmentRequest request) {
        User currentUser = userService.getCurrentUser();
        Appointment appointment = findAccessibleAppointment(id, currentUser);

        if (!appointment.isEditable()) {
            throw new InvalidStateTransitionException("appointment", appointment.getStatus(), "update");
        }

        applyRequest(appointment, request, currentUser);
        log.info("Appointment {} updated", id);
        return mapToAppointmentResponse(appointmentRepository.save(appointment), currentUser);
    }

    @Transactional(readOnly = true)
    public AppointmentResponse getAppointmentById(UUID id) {
        User currentUser = userService.getCurrentUser();
        return mapToAppointmentResponse(findAccessibleAppointment(id, currentUser), currentUser);
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<AppointmentResponse> getAllAppointments(int page, int limit, UUID patientId,
                                                                     UUID guardianId, UUID veterinarianId,
                                                                     AppointmentStatus status, AppointmentType type,
                                                                     LocalDate startDate, LocalDate endDate,
                                                                     String search) {
        User currentUser = userService.getCurrentUser();
        UUID guardianFilter = currentUser.isGuardian() ? currentUser.getId() : guardianId;
        UUID scopeVetId = currentUser.isVeterinarian() ? currentUser.getId() : null;

        Pageable pageable = PaginationUtil.pageOf(page, limit, Sort.by("scheduledAt").descending());
        Page<Appointment> appointments = appointmentRepository.searchAppointments(
                patientId, guardianFilter, veterinarianId, scopeVetId, status, type,
                startDate != null ? DateUtil.getStartOfDay(startDate) : null,
                endDate != null ? DateUtil.getStartOfNextDay(endDate) : null,
                search, pageable);

        List<AppointmentResponse> responses = appointments.getContent()
                .stream()
                .map(appointment -> mapToAppointmentResponse(appointment, currentUser))
                .collect(Collectors.toList());

        return PaginatedResponse.of(responses, page, limit, appointments.getTotalElements());
    }

    @Transactional(readOnly = true)
    public List<AppointmentResponse> getMyAppointments(AppointmentStatus status) {
        User currentUser = userService.getCurrentUser();
        List<Appointment> appointments;
        if (currentUser.isGuardian()) {
            appointments = status == null
                    ? appointmentRepository.findByGuardianIdOrderByScheduledAtDesc(currentUser.getId())
                    : appointmentRepository.findByGuardianIdAndStatusOrderByScheduledAtDesc(currentUser.getId(), status);
        } else if (currentUser.isVeterinarian()) {
            appointments = status == null
                    ? appointmentRepository.findByVeterinarianIdOrderByScheduledAtDesc(currentUser.getId())
                    : appointmentRepository.findByVeterinarianIdAndStatusOrderByScheduledAtDesc(currentUser.getId(), status);
        } else {
            throw new ForbiddenException("Only guardians and veterinarians have personal appointments");
        }

        return appointments.stream()
                .map(appointment -> mapToAppointmentResponse(appointment, currentUser))
                .collect(Collectors.toList());
    }

    /**
     * Appointments of one day that are still on the agenda. Veterinarians default to their own schedule.
     */
    @Transactional(readOnly = true)
    public List<AppointmentResponse> getVetSchedule(LocalDate date, UUID veterinarianId) {
        User currentUser = userService.getCurrentUser();
        UUID vetFilter = veterinarianId;
        if (vetFilter == null && currentUser.isVeterinarian()) {
            vetFilter = currentUser.getId();
        }

        return findDaySchedule(date, vetFilter)
                .stream()
                .map(appointment -> mapToAppointmentResponse(appointment, currentUser))
                .collect(Collectors.toList());
    }

    public List<Appointment> findDaySchedule(LocalDate date, UUID veterinarianId) {
        LocalDateTime from = DateUtil.getStartOfDay(date);
        LocalDateTime to = DateUtil.getStartOfNextDay(date);
        if (veterinarianId != null) {
            return appointmentRepository
                    .findByVeterinarianIdAndScheduledAtGreaterThanEqualAndScheduledAtLessThanAndStatusNotInOrderByScheduledAtAsc(
                            veterinarianId, from, to, AppointmentStatus.INACTIVE);
        }
        return appointmentRepository
                .findByScheduledAtGreaterThanEqualAndScheduledAtLessThanAndStatusNotInOrderByScheduledAtAsc(
                        from, to, AppointmentStatus.INACTIVE);
    }

    @Transactional(readOnly = true)
    public List<AppointmentResponse> getUpcomingAppointments(int days) {
        if (days < 1) {
            throw ValidationException.of("upcoming", "days", "Days must be at least 1");
        }
        User currentUser = userService.getCurrentUser();
        LocalDateTime now = LocalDateTime.now(clock);

        return appointmentRepository
                .findByScheduledAtGreaterThanEqualAndScheduledAtLessThanAndStatusNotInOrderByScheduledAtAsc(
                        now, now.plusDays(days), AppointmentStatus.INACTIVE)
                .stream()
                .filter(appointment -> isInPersonalScope(appointment, currentUser))
                .map(appointment -> mapToAppointmentResponse(appointment, currentUser))
                .collect(Collectors.toList());
    }

    @Transactional
    public AppointmentResponse confirm(UUID id) {
        return transition(id, "confirmed", appointment -> appointment.confirm(LocalDateTime.now(clock)));
    }

    @Transactional
    public AppointmentResponse start(UUID id) {
        return transition(id, "started", Appointment::start);
    }

    @Transactional
    public AppointmentResponse complete(UUID id) {
        return transition(id, "completed", appointment -> appointment.complete(LocalDateTime.now(clock)));
    }

    @Transactional
    public AppointmentResponse cancel(UUID id, String reason) {
        return transition(id, "cancelled", appointment -> appointment.cancel(reason, LocalDateTime.now(clock)));
    }

    @Transactional
    public AppointmentResponse markNoShow(UUID id) {
        return transition(id, "marked as no-show", Appointment::markNoShow);
    }

    public Appointment findAppointment(UUID id) {
        return appointmentRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", "id", id));
    }

    public AppointmentResponse mapToAppointmentResponse(Appointment appointment, User viewer) {
        if (appointment == null) return null;

        User vet = appointment.getVeterinarian();
        boolean showInternal = viewer != null && viewer.isStaff();
        return AppointmentResponse.builder()
                .id(appointment.getId())
                .patientId(appointment.getPatient().getId())
                .patientName(appointment.getPatient().getName())
                .guardianId(appointment.getGuardian().getId())
                .guardianName(appointment.getGuardian().getFullName())
                .veterinarianId(vet != null ? vet.getId() : null)
                .veterinarianName(vet != null ? vet.getFullName() : null)
                .scheduledAt(appointment.getScheduledAt())
                .estimatedEnd(appointment.getEstimatedEnd())
                .durationMinutes(appointment.getDurationMinutes())
                .type(appointment.getType())
                .status(appointment.getStatus())
                .reason(appointment.getReason())
                .notes(appointment.getNotes())
                .internalNotes(showInternal ? appointment.getInternalNotes() : null)
                .reminderSent(appointment.isReminderSent())
                .reminderSentAt(appointment.getReminderSentAt())
                .confirmedAt(appointment.getConfirmedAt())
                .attendedAt(appointment.getAttendedAt())
                .cancelledAt(appointment.getCancelledAt())
                .cancellationReason(appointment.getCancellationReason())
                .overdue(appointment.isOverdue(LocalDateTime.now(clock)))
                .cancellable(appointment.isCancellable())
                .createdAt(appointment.getCreatedAt())
                .updatedAt(appointment.getUpdatedAt())
                .build();
    }

    private AppointmentResponse transition(UUID id, String outcome, Consumer<Appointment> action) {
        User currentUser = userService.getCurrentUser();
        Appointment appointment = findAccessibleAppointment(id, currentUser);
        AppointmentStatus before = appointment.getStatus();

        try {
            action.accept(appointment);
        } catch (InvalidStateTransitionException e) {
            log.warn("Appointment {} could not be {} from {}", id, outcome, before);
            throw e;
        }

        Appointment saved = appointmentRepository.save(appointment);
        log.info("Appointment {} {} by {} ({} -> {})", id, outcome, currentUser.getUsername(), before, saved.getStatus());
        return mapToAppointmentResponse(saved, currentUser);
    }

    private void applyRequest(Appointment appointment, AppointmentRequest request, User currentUser) {
        Patient patient = patientService.findPatient(request.getPatientId());
        User owner = patient.getGuardian();

        if (currentUser.isGuardian() && !owner.getId().equals(currentUser.getId())) {
            throw new ForbiddenException("Guardians can only book appointments for their own patients");
        }
        if (!patient.isActive()) {
            throw ValidationException.of("appointment", "patientId", "Patient is not active");
        }
        if (request.getGuardianId() != null && !request.getGuardianId().equals(owner.getId())) {
            throw ValidationException.of("appointment", "guardianId",
                    "Appointment guardian must be the patient's guardian");
        }

        User veterinarian = null;
        if (request.getVeterinarianId() != null) {
            veterinarian = userService.findUser(request.getVeterinarianId());
            if (veterinarian.getRole() != Role.VETERINARIAN) {
                throw ValidationException.of("appointment", "veterinarianId",
                        "Assigned user must have the veterinarian role");
            }
        }

        appointment.setPatient(patient);
        appointment.setGuardian(owner);
        appointment.setVeterinarian(veterinarian);
        appointment.setScheduledAt(request.getScheduledAt());
        appointment.setDurationMinutes(request.getDurationMinutes() != null
                ? request.getDurationMinutes() : Appointment.DEFAULT_DURATION_MINUTES);
        appointment.setType(request.getType() != null ? request.getType() : AppointmentType.GENERAL_CONSULTATION);
        appointment.setReason(request.getReason());
        appointment.setNotes(request.getNotes());
        if (currentUser.isStaff()) {
            appointment.setInternalNotes(request.getInternalNotes());
        }
    }

    private Appointment findAccessibleAppointment(UUID id, User currentUser) {
        Appointment appointment = findAppointment(id);
        if (!isVisibleTo(appointment, currentUser)) {
            throw new ResourceNotFoundException("Appointment", "id", id);
        }
        return appointment;
    }

    private boolean isVisibleTo(Appointment appointment, User user) {
        if (user.isGuardian()) {
            return appointment.getGuardian().getId().equals(user.getId());
        }
        if (user.isVeterinarian()) {
            return appointment.getVeterinarian() == null
                    || appointment.getVeterinarian().getId().equals(user.getId());
        }
        return true;
    }

    private boolean isInPersonalScope(Appointment appointment, User user) {
        if (user.isGuardian()) {
            return appointment.getGuardian().getId().equals(user.getId());
        }
        if (user.isVeterinarian()) {
            return appointment.getVeterinarian() != null
                    && appointment.getVeterinarian().getId().equals(user.getId());
        }
        return true;
    }
}
