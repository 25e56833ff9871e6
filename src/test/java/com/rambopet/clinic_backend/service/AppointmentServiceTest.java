package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.dto.request.AppointmentRequest;
import com.rambopet.clinic_backend.dto.response.AppointmentResponse;
import com.rambopet.clinic_backend.enums.AppointmentStatus;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.exception.ForbiddenException;
import com.rambopet.clinic_backend.exception.InvalidStateTransitionException;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.Appointment;
import com.rambopet.clinic_backend.model.Patient;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.repository.AppointmentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AppointmentServiceTest {

    private static final ZoneId ZONE = ZoneId.of("America/Mexico_City");
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 9, 0);

    @Mock
    private AppointmentRepository appointmentRepository;

    @Mock
    private PatientService patientService;

    @Mock
    private UserService userService;

    private AppointmentService appointmentService;

    private User guardian;
    private User receptionist;
    private User vet;
    private Patient patient;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(NOW.atZone(ZONE).toInstant(), ZONE);
        appointmentService = new AppointmentService(appointmentRepository, patientService, userService, clock);

        guardian = user(Role.GUARDIAN, "ana");
        receptionist = user(Role.RECEPTIONIST, "rita");
        vet = user(Role.VETERINARIAN, "victor");
        patient = Patient.builder().id(UUID.randomUUID()).name("Rambo").guardian(guardian).build();

        when(patientService.findPatient(patient.getId())).thenReturn(patient);
        when(userService.findUser(vet.getId())).thenReturn(vet);
        when(appointmentRepository.save(any(Appointment.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void create_defaultsGuardianFromPatient() {
        when(userService.getCurrentUser()).thenReturn(receptionist);

        AppointmentResponse response = appointmentService.createAppointment(request(null, vet.getId(), NOW.plusDays(1)));

        assertEquals(guardian.getId(), response.getGuardianId());
        assertEquals(AppointmentStatus.BOOKED, response.getStatus());
        assertEquals(vet.getId(), response.getVeterinarianId());
    }

    @Test
    void create_rejectsGuardianThatDoesNotOwnPatient() {
        when(userService.getCurrentUser()).thenReturn(receptionist);
        User otherGuardian = user(Role.GUARDIAN, "otto");

        ValidationException ex = assertThrows(ValidationException.class,
                () -> appointmentService.createAppointment(request(otherGuardian.getId(), null, NOW.plusDays(1))));

        assertEquals("guardianId", ex.getFieldErrors().get(0).getField());
        verify(appointmentRepository, never()).save(any());
    }

    @Test
    void create_rejectsPastTime() {
        when(userService.getCurrentUser()).thenReturn(receptionist);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> appointmentService.createAppointment(request(null, null, NOW.minusMinutes(1))));

        assertEquals("scheduledAt", ex.getFieldErrors().get(0).getField());
    }

    @Test
    void create_rejectsNonVeterinarianAssignee() {
        when(userService.getCurrentUser()).thenReturn(receptionist);
        when(userService.findUser(receptionist.getId())).thenReturn(receptionist);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> appointmentService.createAppointment(request(null, receptionist.getId(), NOW.plusDays(1))));

        assertEquals("veterinarianId", ex.getFieldErrors().get(0).getField());
    }

    @Test
    void create_guardianCannotBookForSomeoneElsesPatient() {
        when(userService.getCurrentUser()).thenReturn(user(Role.GUARDIAN, "otto"));

        assertThrows(ForbiddenException.class,
                () -> appointmentService.createAppointment(request(null, null, NOW.plusDays(1))));
    }

    @Test
    void guardianNeverSeesInternalNotes() {
        Appointment appointment = Appointment.builder()
                .id(UUID.randomUUID())
                .patient(patient)
                .guardian(guardian)
                .scheduledAt(NOW.plusDays(1))
                .reason("Vaccines")
                .internalNotes("Aggressive with strangers")
                .build();
        when(appointmentRepository.findById(appointment.getId())).thenReturn(Optional.of(appointment));

        when(userService.getCurrentUser()).thenReturn(guardian);
        assertNull(appointmentService.getAppointmentById(appointment.getId()).getInternalNotes());

        when(userService.getCurrentUser()).thenReturn(receptionist);
        assertEquals("Aggressive with strangers",
                appointmentService.getAppointmentById(appointment.getId()).getInternalNotes());
    }

    @Test
    void confirm_twiceFailsTheSecondTime() {
        Appointment appointment = Appointment.builder()
                .id(UUID.randomUUID())
                .patient(patient)
                .guardian(guardian)
                .scheduledAt(NOW.plusDays(1))
                .reason("Vaccines")
                .build();
        when(appointmentRepository.findById(appointment.getId())).thenReturn(Optional.of(appointment));
        when(userService.getCurrentUser()).thenReturn(guardian);

        AppointmentResponse confirmed = appointmentService.confirm(appointment.getId());

        assertEquals(AppointmentStatus.CONFIRMED, confirmed.getStatus());
        assertEquals(NOW, confirmed.getConfirmedAt());
        assertThrows(InvalidStateTransitionException.class, () -> appointmentService.confirm(appointment.getId()));
    }

    @Test
    void update_rejectedOnceCompleted() {
        Appointment appointment = Appointment.builder()
                .id(UUID.randomUUID())
                .patient(patient)
                .guardian(guardian)
                .scheduledAt(NOW.minusHours(2))
                .reason("Vaccines")
                .status(AppointmentStatus.COMPLETED)
                .build();
        when(appointmentRepository.findById(appointment.getId())).thenReturn(Optional.of(appointment));
        when(userService.getCurrentUser()).thenReturn(receptionist);

        assertThrows(InvalidStateTransitionException.class,
                () -> appointmentService.updateAppointment(appointment.getId(), request(null, null, NOW.plusDays(2))));
    }

    @Test
    void myAppointments_forbiddenForReceptionist() {
        when(userService.getCurrentUser()).thenReturn(receptionist);

        assertThrows(ForbiddenException.class, () -> appointmentService.getMyAppointments(null));
    }

    private AppointmentRequest request(UUID guardianId, UUID vetId, LocalDateTime scheduledAt) {
        return AppointmentRequest.builder()
                .patientId(patient.getId())
                .guardianId(guardianId)
                .veterinarianId(vetId)
                .scheduledAt(scheduledAt)
                .reason("Vaccines")
                .build();
    }

    private static User user(Role role, String username) {
        return User.builder()
                .id(UUID.randomUUID())
                .username(username)
                .email(username + "@rambopet.test")
                .firstName(username)
                .lastName("Tester")
                .role(role)
                .build();
    }
}
