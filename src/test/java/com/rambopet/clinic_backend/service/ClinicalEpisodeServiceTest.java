package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.config.ClinicProperties;
import com.rambopet.clinic_backend.dto.request.ClinicalEpisodeRequest;
import com.rambopet.clinic_backend.dto.request.VitalSignsRequest;
import com.rambopet.clinic_backend.dto.response.ClinicalEpisodeResponse;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.exception.ApiException;
import com.rambopet.clinic_backend.exception.InvalidStateTransitionException;
import com.rambopet.clinic_backend.exception.ResourceNotFoundException;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.Appointment;
import com.rambopet.clinic_backend.model.ClinicalEpisode;
import com.rambopet.clinic_backend.model.Patient;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.repository.AttachmentRepository;
import com.rambopet.clinic_backend.repository.ClinicalEpisodeRepository;
import com.rambopet.clinic_backend.repository.VitalSignsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClinicalEpisodeServiceTest {

    @Mock
    private ClinicalEpisodeRepository episodeRepository;

    @Mock
    private VitalSignsRepository vitalSignsRepository;

    @Mock
    private AttachmentRepository attachmentRepository;

    @Mock
    private AppointmentService appointmentService;

    @Mock
    private PatientService patientService;

    @Mock
    private UserService userService;

    private ClinicalEpisodeService episodeService;

    private User guardian;
    private User vet;
    private Patient patient;
    private Appointment appointment;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        episodeService = new ClinicalEpisodeService(episodeRepository, vitalSignsRepository, attachmentRepository,
                appointmentService, patientService, userService, new ClinicProperties());

        guardian = User.builder().id(UUID.randomUUID()).firstName("Ana").lastName("Lopez").role(Role.GUARDIAN).build();
        vet = User.builder().id(UUID.randomUUID()).firstName("Victor").lastName("Ruiz").role(Role.VETERINARIAN).build();
        patient = Patient.builder().id(UUID.randomUUID()).name("Rambo").guardian(guardian).build();
        appointment = Appointment.builder()
                .id(UUID.randomUUID())
                .patient(patient)
                .guardian(guardian)
                .veterinarian(vet)
                .scheduledAt(LocalDateTime.of(2025, 3, 10, 10, 0))
                .reason("Limping on the left hind leg")
                .build();

        when(appointmentService.findAppointment(appointment.getId())).thenReturn(appointment);
        when(userService.getCurrentUser()).thenReturn(vet);
        when(episodeRepository.save(any(ClinicalEpisode.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void create_takesPatientVetAndReasonFromAppointment() {
        ClinicalEpisodeResponse response = episodeService.createEpisode(
                ClinicalEpisodeRequest.builder().appointmentId(appointment.getId()).build());

        assertEquals(patient.getId(), response.getPatientId());
        assertEquals(vet.getId(), response.getVeterinarianId());
        assertEquals("Limping on the left hind leg", response.getReason());
        assertFalse(response.isClosed());
    }

    @Test
    void create_rejectsSecondEpisodeForSameAppointment() {
        when(episodeRepository.existsByAppointmentId(appointment.getId())).thenReturn(true);

        ApiException ex = assertThrows(ApiException.class, () -> episodeService.createEpisode(
                ClinicalEpisodeRequest.builder().appointmentId(appointment.getId()).build()));

        assertEquals(HttpStatus.CONFLICT, ex.getStatus());
        assertEquals("DUPLICATE_EPISODE", ex.getErrorCode());
        verify(episodeRepository, never()).save(any());
    }

    @Test
    void create_rejectsPatientOtherThanTheAppointments() {
        ValidationException ex = assertThrows(ValidationException.class, () -> episodeService.createEpisode(
                ClinicalEpisodeRequest.builder()
                        .appointmentId(appointment.getId())
                        .patientId(UUID.randomUUID())
                        .build()));

        assertEquals("patientId", ex.getFieldErrors().get(0).getField());
    }

    @Test
    void closedEpisode_rejectsUpdatesAndVitals() {
        ClinicalEpisode episode = episode(true);

        assertThrows(InvalidStateTransitionException.class, () -> episodeService.updateEpisode(episode.getId(),
                ClinicalEpisodeRequest.builder().definitiveDiagnosis("Sprain").build()));
        assertThrows(InvalidStateTransitionException.class, () -> episodeService.recordVitals(episode.getId(),
                VitalSignsRequest.builder().weight(new BigDecimal("12.4")).build()));
        assertNull(episode.getDefinitiveDiagnosis());
        verify(vitalSignsRepository, never()).save(any());
    }

    @Test
    void close_twiceIsRejected_andReopenRestores() {
        ClinicalEpisode episode = episode(false);

        assertTrue(episodeService.closeEpisode(episode.getId()).isClosed());
        assertThrows(InvalidStateTransitionException.class, () -> episodeService.closeEpisode(episode.getId()));
        assertFalse(episodeService.reopenEpisode(episode.getId()).isClosed());
    }

    @Test
    void guardian_cannotSeeAnotherGuardiansEpisode() {
        ClinicalEpisode episode = episode(false);
        when(userService.getCurrentUser()).thenReturn(
                User.builder().id(UUID.randomUUID()).role(Role.GUARDIAN).build());

        assertThrows(ResourceNotFoundException.class, () -> episodeService.getEpisodeById(episode.getId()));
    }

    private ClinicalEpisode episode(boolean closed) {
        ClinicalEpisode episode = ClinicalEpisode.builder()
                .id(UUID.randomUUID())
                .appointment(appointment)
                .patient(patient)
                .veterinarian(vet)
                .reason(appointment.getReason())
                .closed(closed)
                .build();
        when(episodeRepository.findById(episode.getId())).thenReturn(Optional.of(episode));
        return episode;
    }
}
