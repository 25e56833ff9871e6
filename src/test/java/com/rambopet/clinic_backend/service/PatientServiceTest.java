package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.config.ClinicProperties;
import com.rambopet.clinic_backend.dto.request.PatientRequest;
import com.rambopet.clinic_backend.dto.response.PatientResponse;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.exception.ForbiddenException;
import com.rambopet.clinic_backend.exception.InvalidStateTransitionException;
import com.rambopet.clinic_backend.exception.ResourceNotFoundException;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.Appointment;
import com.rambopet.clinic_backend.model.Breed;
import com.rambopet.clinic_backend.model.Patient;
import com.rambopet.clinic_backend.model.Species;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.repository.AppointmentRepository;
import com.rambopet.clinic_backend.repository.PatientRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PatientServiceTest {

    private static final ZoneId ZONE = ZoneId.of("America/Mexico_City");
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    @Mock
    private PatientRepository patientRepository;

    @Mock
    private AppointmentRepository appointmentRepository;

    @Mock
    private SpeciesService speciesService;

    @Mock
    private UserService userService;

    private PatientService patientService;

    private User guardian;
    private Species dog;
    private Species cat;
    private Breed siamese;
    private Breed labrador;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(TODAY.atStartOfDay(ZONE).toInstant(), ZONE);
        patientService = new PatientService(patientRepository, appointmentRepository, speciesService, userService, new ClinicProperties(), clock);

        guardian = User.builder().id(UUID.randomUUID()).username("ana").firstName("Ana").lastName("Lopez")
                .role(Role.GUARDIAN).build();
        dog = Species.builder().id(UUID.randomUUID()).name("Dog").build();
        cat = Species.builder().id(UUID.randomUUID()).name("Cat").build();
        siamese = Breed.builder().id(UUID.randomUUID()).name("Siamese").species(cat).build();
        labrador = Breed.builder().id(UUID.randomUUID()).name("Labrador").species(dog).build();

        when(speciesService.findSpecies(dog.getId())).thenReturn(dog);
        when(speciesService.findBreed(siamese.getId())).thenReturn(siamese);
        when(speciesService.findBreed(labrador.getId())).thenReturn(labrador);
        when(userService.getCurrentUser()).thenReturn(guardian);
        when(patientRepository.save(any(Patient.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void create_rejectsBreedFromAnotherSpecies() {
        PatientRequest request = PatientRequest.builder()
                .name("Rambo")
                .speciesId(dog.getId())
                .breedId(siamese.getId())
                .build();

        ValidationException ex = assertThrows(ValidationException.class, () -> patientService.createPatient(request));

        assertEquals("breedId", ex.getFieldErrors().get(0).getField());
        verify(patientRepository, never()).save(any());
    }

    @Test
    void create_byGuardian_assignsCurrentUser() {
        PatientRequest request = PatientRequest.builder()
                .name("Rambo")
                .speciesId(dog.getId())
                .breedId(labrador.getId())
                .birthDate(TODAY.minusYears(3).plusDays(1))
                .build();

        PatientResponse response = patientService.createPatient(request);

        assertEquals(guardian.getId(), response.getGuardianId());
        assertEquals("Labrador", response.getBreedName());
        assertEquals(2, response.getAgeInYears());
    }

    @Test
    void create_guardianCannotRegisterForAnotherGuardian() {
        PatientRequest request = PatientRequest.builder()
                .guardianId(UUID.randomUUID())
                .name("Rambo")
                .speciesId(dog.getId())
                .build();

        assertThrows(ForbiddenException.class, () -> patientService.createPatient(request));
    }

    @Test
    void markDeceased_deactivatesPatient_andSecondCallConflicts() {
        Patient patient = Patient.builder().id(UUID.randomUUID()).name("Rambo").guardian(guardian).species(dog).build();
        when(patientRepository.findById(patient.getId())).thenReturn(Optional.of(patient));

        PatientResponse response = patientService.markDeceased(patient.getId(), TODAY);

        assertTrue(response.isDeceased());
        assertFalse(response.isActive());
        assertEquals(TODAY, response.getDateOfDeath());
        assertThrows(InvalidStateTransitionException.class, () -> patientService.markDeceased(patient.getId(), TODAY));
    }

    @Test
    void guardianGetsNotFoundForOtherGuardiansPatient() {
        User other = User.builder().id(UUID.randomUUID()).username("otto").role(Role.GUARDIAN).build();
        Patient patient = Patient.builder().id(UUID.randomUUID()).name("Misu").guardian(other).species(cat).build();
        when(patientRepository.findById(patient.getId())).thenReturn(Optional.of(patient));

        assertThrows(ResourceNotFoundException.class, () -> patientService.getPatientById(patient.getId()));
    }

    @Test
    void update_reassigningGuardian_movesPatientAppointmentsToNewGuardian() {
        User receptionist = User.builder().id(UUID.randomUUID()).username("rita").role(Role.RECEPTIONIST).build();
        User newGuardian = User.builder().id(UUID.randomUUID()).username("beto").role(Role.GUARDIAN).build();
        Patient patient = Patient.builder().id(UUID.randomUUID()).name("Rambo").guardian(guardian).species(dog).build();
        Appointment booked = Appointment.builder().id(UUID.randomUUID()).patient(patient).guardian(guardian)
                .scheduledAt(LocalDateTime.of(2025, 3, 12, 10, 0)).reason("Vaccination").build();
        when(userService.getCurrentUser()).thenReturn(receptionist);
        when(userService.findUser(newGuardian.getId())).thenReturn(newGuardian);
        when(patientRepository.findById(patient.getId())).thenReturn(Optional.of(patient));
        when(appointmentRepository.findByPatientId(patient.getId())).thenReturn(List.of(booked));

        PatientRequest request = PatientRequest.builder()
                .guardianId(newGuardian.getId())
                .name("Rambo")
                .speciesId(dog.getId())
                .build();
        PatientResponse response = patientService.updatePatient(patient.getId(), request);

        assertEquals(newGuardian.getId(), response.getGuardianId());
        assertSame(newGuardian, booked.getGuardian());
        verify(appointmentRepository).saveAll(List.of(booked));
    }

    @Test
    void update_withSameGuardian_leavesAppointmentsAlone() {
        User receptionist = User.builder().id(UUID.randomUUID()).username("rita").role(Role.RECEPTIONIST).build();
        Patient patient = Patient.builder().id(UUID.randomUUID()).name("Rambo").guardian(guardian).species(dog).build();
        when(userService.getCurrentUser()).thenReturn(receptionist);
        when(patientRepository.findById(patient.getId())).thenReturn(Optional.of(patient));

        PatientRequest request = PatientRequest.builder()
                .guardianId(guardian.getId())
                .name("Rambo")
                .speciesId(dog.getId())
                .build();
        patientService.updatePatient(patient.getId(), request);

        verify(appointmentRepository, never()).findByPatientId(any());
    }
}
