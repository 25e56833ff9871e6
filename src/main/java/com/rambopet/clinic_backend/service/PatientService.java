package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.config.ClinicProperties;
import com.rambopet.clinic_backend.dto.request.PatientRequest;
import com.rambopet.clinic_backend.dto.response.PaginatedResponse;
import com.rambopet.clinic_backend.dto.response.PatientResponse;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.enums.Sex;
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
import com.rambopet.clinic_backend.util.Constants;
import com.rambopet.clinic_backend.util.FileUploadUtil;
import com.rambopet.clinic_backend.util.PaginationUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PatientService {

    private final PatientRepository patientRepository;
    private final AppointmentRepository appointmentRepository;
    private final SpeciesService speciesService;
    private final UserService userService;
    private final ClinicProperties clinicProperties;
    private final Clock clock;

    /**
     * Lists patients. Guardians only ever see their own, whatever {@code guardianId} says.
     */
    @Transactional(readOnly = true)
    public PaginatedResponse<PatientResponse> getAllPatients(int page, int limit, UUID guardianId, UUID speciesId,
                                                             Sex sex, Boolean active, Boolean deceased, String search) {
        User currentUser = userService.getCurrentUser();
        UUID guardianFilter = currentUser.isGuardian() ? currentUser.getId() : guardianId;

        Pageable pageable = PaginationUtil.pageOf(page, limit, Sort.by("name").ascending());
        Page<Patient> patientsPage = patientRepository.searchPatients(
                guardianFilter, speciesId, sex, active, deceased, search, pageable);

        List<PatientResponse> responses = patientsPage.getContent()
                .stream()
                .map(this::mapToPatientResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(responses, page, limit, patientsPage.getTotalElements());
    }

    @Transactional(readOnly = true)
    public List<PatientResponse> getMyPatients() {
        User currentUser = userService.getCurrentUser();
        return patientRepository.findByGuardianIdAndActiveTrueOrderByNameAsc(currentUser.getId())
                .stream()
                .map(this::mapToPatientResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public PatientResponse getPatientById(UUID id) {
        return mapToPatientResponse(findAccessiblePatient(id));
    }

    @Transactional
    public PatientResponse createPatient(PatientRequest request) {
        User currentUser = userService.getCurrentUser();
        User guardian = resolveGuardian(request.getGuardianId(), currentUser);

        Patient patient = new Patient();
        patient.setGuardian(guardian);
        applyRequest(patient, request);
        if (request.getMicrochip() != null && !request.getMicrochip().isBlank()
                && patientRepository.existsByMicrochip(request.getMicrochip().trim())) {
            throw ValidationException.of("patient", "microchip", "Microchip already registered");
        }

        Patient saved = patientRepository.save(patient);
        log.info("Patient created: {} ({}) for guardian {}", saved.getName(), saved.getId(), guardian.getUsername());
        return mapToPatientResponse(saved);
    }

    @Transactional
    public PatientResponse updatePatient(UUID id, PatientRequest request) {
        User currentUser = userService.getCurrentUser();
        Patient patient = findAccessiblePatient(id);

        User newGuardian = null;
        if (!currentUser.isGuardian() && request.getGuardianId() != null
                && !request.getGuardianId().equals(patient.getGuardian().getId())) {
            newGuardian = resolveGuardian(request.getGuardianId(), currentUser);
            patient.setGuardian(newGuardian);
        }
        applyRequest(patient, request);
        if (patient.getMicrochip() != null && patientRepository.existsByMicrochipAndIdNot(patient.getMicrochip(), id)) {
            throw ValidationException.of("patient", "microchip", "Microchip already registered");
        }
        if (newGuardian != null) {
            reassignAppointments(patient, newGuardian);
        }

        log.info("Patient updated: {}", id);
        return mapToPatientResponse(patientRepository.save(patient));
    }

    @Transactional
    public PatientResponse markDeceased(UUID id, LocalDate dateOfDeath) {
        if (dateOfDeath == null) {
            throw ValidationException.of("patient", "dateOfDeath", "Date of death is required");
        }
        Patient patient = findAccessiblePatient(id);
        if (patient.isDeceased()) {
            throw new InvalidStateTransitionException("Patient is already registered as deceased");
        }
        if (patient.getBirthDate() != null && dateOfDeath.isBefore(patient.getBirthDate())) {
            throw ValidationException.of("patient", "dateOfDeath", "Date of death cannot be before birth date");
        }

        patient.markDeceased(dateOfDeath);
        log.info("Patient {} marked as deceased on {}", id, dateOfDeath);
        return mapToPatientResponse(patientRepository.save(patient));
    }

    @Transactional
    public PatientResponse updateWeight(UUID id, BigDecimal weight) {
        if (weight == null || weight.signum() <= 0) {
            throw ValidationException.of("patient", "weight", "Weight must be greater than zero");
        }
        Patient patient = findAccessiblePatient(id);
        patient.setCurrentWeight(weight);
        log.info("Patient {} weight updated to {}", id, weight);
        return mapToPatientResponse(patientRepository.save(patient));
    }

    @Transactional
    public PatientResponse uploadPhoto(UUID id, MultipartFile file) {
        if (!FileUploadUtil.isValidImageFile(file)) {
            throw ValidationException.of("patient", "file", "Patient photo must be an image");
        }
        Patient patient = findAccessiblePatient(id);
        String previous = patient.getPhoto();

        patient.setPhoto(FileUploadUtil.saveFile(clinicProperties.getUploadDir(), file, Constants.PATIENT_PHOTO_DIR));
        Patient saved = patientRepository.save(patient);
        FileUploadUtil.deleteFile(clinicProperties.getUploadDir(), previous);

        return mapToPatientResponse(saved);
    }

    @Transactional
    public void deactivatePatient(UUID id) {
        Patient patient = findAccessiblePatient(id);
        patient.setActive(false);
        patientRepository.save(patient);
        log.info("Patient deactivated: {}", id);
    }

    public Patient findPatient(UUID id) {
        return patientRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Patient", "id", id));
    }

    /**
     * Loads a patient the current user may see. Guardians get a 404 for other guardians' patients.
     */
    public Patient findAccessiblePatient(UUID id) {
        Patient patient = findPatient(id);
        User currentUser = userService.getCurrentUser();
        if (currentUser.isGuardian() && !patient.getGuardian().getId().equals(currentUser.getId())) {
            throw new ResourceNotFoundException("Patient", "id", id);
        }
        return patient;
    }

    public PatientResponse mapToPatientResponse(Patient patient) {
        if (patient == null) return null;

        Breed breed = patient.getBreed();
        return PatientResponse.builder()
                .id(patient.getId())
                .guardianId(patient.getGuardian().getId())
                .guardianName(patient.getGuardian().getFullName())
                .name(patient.getName())
                .speciesId(patient.getSpecies().getId())
                .speciesName(patient.getSpecies().getName())
                .breedId(breed != null ? breed.getId() : null)
                .breedName(breed != null ? breed.getName() : null)
                .sex(patient.getSex())
                .birthDate(patient.getBirthDate())
                .ageInYears(patient.ageInYears(LocalDate.now(clock)))
                .color(patient.getColor())
                .currentWeight(patient.getCurrentWeight())
                .microchip(patient.getMicrochip())
                .photo(patient.getPhoto())
                .neutered(patient.isNeutered())
                .allergies(patient.getAllergies())
                .chronicConditions(patient.getChronicConditions())
                .notes(patient.getNotes())
                .active(patient.isActive())
                .deceased(patient.isDeceased())
                .dateOfDeath(patient.getDateOfDeath())
                .createdAt(patient.getCreatedAt())
                .updatedAt(patient.getUpdatedAt())
                .build();
    }

    private void applyRequest(Patient patient, PatientRequest request) {
        Species species = speciesService.findSpecies(request.getSpeciesId());
        Breed breed = null;
        if (request.getBreedId() != null) {
            breed = speciesService.findBreed(request.getBreedId());
            if (!breed.getSpecies().getId().equals(species.getId())) {
                throw ValidationException.of("patient", "breedId",
                        "Breed " + breed.getName() + " does not belong to species " + species.getName());
            }
        }

        patient.setName(request.getName().trim());
        patient.setSpecies(species);
        patient.setBreed(breed);
        patient.setSex(request.getSex() != null ? request.getSex() : Sex.UNKNOWN);
        patient.setBirthDate(request.getBirthDate());
        patient.setColor(request.getColor());
        patient.setCurrentWeight(request.getCurrentWeight());
        patient.setMicrochip(request.getMicrochip() == null || request.getMicrochip().isBlank()
                ? null : request.getMicrochip().trim());
        if (request.getNeutered() != null) {
            patient.setNeutered(request.getNeutered());
        }
        patient.setAllergies(request.getAllergies());
        patient.setChronicConditions(request.getChronicConditions());
        patient.setNotes(request.getNotes());
    }

    // Appointments always belong to the patient's current guardian
    private void reassignAppointments(Patient patient, User newGuardian) {
        List<Appointment> appointments = appointmentRepository.findByPatientId(patient.getId());
        if (appointments.isEmpty()) {
            return;
        }
        appointments.forEach(appointment -> appointment.setGuardian(newGuardian));
        appointmentRepository.saveAll(appointments);
        log.info("Moved {} appointment(s) of patient {} to guardian {}",
                appointments.size(), patient.getId(), newGuardian.getUsername());
    }

    private User resolveGuardian(UUID requestedGuardianId, User currentUser) {
        if (currentUser.isGuardian()) {
            if (requestedGuardianId != null && !requestedGuardianId.equals(currentUser.getId())) {
                throw new ForbiddenException("Guardians can only register their own patients");
            }
            return currentUser;
        }
        if (requestedGuardianId == null) {
            throw ValidationException.of("patient", "guardianId", "Guardian is required");
        }
        User guardian = userService.findUser(requestedGuardianId);
        if (guardian.getRole() != Role.GUARDIAN) {
            throw ValidationException.of("patient", "guardianId", "Selected user is not a guardian");
        }
        return guardian;
    }
}
