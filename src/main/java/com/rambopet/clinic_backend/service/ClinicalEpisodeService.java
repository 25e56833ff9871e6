package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.config.ClinicProperties;
import com.rambopet.clinic_backend.dto.request.ClinicalEpisodeRequest;
import com.rambopet.clinic_backend.dto.request.VitalSignsRequest;
import com.rambopet.clinic_backend.dto.response.AttachmentResponse;
import com.rambopet.clinic_backend.dto.response.ClinicalEpisodeResponse;
import com.rambopet.clinic_backend.dto.response.PaginatedResponse;
import com.rambopet.clinic_backend.dto.response.VitalSignsResponse;
import com.rambopet.clinic_backend.enums.AttachmentType;
import com.rambopet.clinic_backend.enums.Prognosis;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.exception.ApiException;
import com.rambopet.clinic_backend.exception.InvalidStateTransitionException;
import com.rambopet.clinic_backend.exception.ResourceNotFoundException;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.Appointment;
import com.rambopet.clinic_backend.model.Attachment;
import com.rambopet.clinic_backend.model.ClinicalEpisode;
import com.rambopet.clinic_backend.model.Patient;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.model.VitalSigns;
import com.rambopet.clinic_backend.repository.AttachmentRepository;
import com.rambopet.clinic_backend.repository.ClinicalEpisodeRepository;
import com.rambopet.clinic_backend.repository.VitalSignsRepository;
import com.rambopet.clinic_backend.util.Constants;
import com.rambopet.clinic_backend.util.DateUtil;
import com.rambopet.clinic_backend.util.FileUploadUtil;
import com.rambopet.clinic_backend.util.PaginationUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ClinicalEpisodeService {

    private final ClinicalEpisodeRepository episodeRepository;
    private final VitalSignsRepository vitalSignsRepository;
    private final AttachmentRepository attachmentRepository;
    private final AppointmentService appointmentService;
    private final PatientService patientService;
    private final UserService userService;
    private final ClinicProperties clinicProperties;

    @Transactional
    public ClinicalEpisodeResponse createEpisode(ClinicalEpisodeRequest request) {
        if (request.getAppointmentId() == null) {
            throw ValidationException.of("episode", "appointmentId", "Appointment is required");
        }
        if (episodeRepository.existsByAppointmentId(request.getAppointmentId())) {
            throw new ApiException("A clinical episode already exists for this appointment",
                    HttpStatus.CONFLICT, "DUPLICATE_EPISODE");
        }

        Appointment appointment = appointmentService.findAppointment(request.getAppointmentId());
        ClinicalEpisode episode = ClinicalEpisode.builder()
                .appointment(appointment)
                .build();

        if (request.getPatientId() != null) {
            if (!request.getPatientId().equals(appointment.getPatient().getId())) {
                throw ValidationException.of("episode", "patientId", "Patient must match the appointment's patient");
            }
            episode.setPatient(appointment.getPatient());
        }
        if (request.getVeterinarianId() != null) {
            episode.setVeterinarian(findVeterinarian(request.getVeterinarianId()));
        }
        episode.setReason(request.getReason());
        applyClinicalFields(episode, request);
        episode.applyAppointmentDefaults();

        User currentUser = userService.getCurrentUser();
        if (episode.getVeterinarian() == null && currentUser.isVeterinarian()) {
            episode.setVeterinarian(currentUser);
        }
        if (episode.getReason() == null || episode.getReason().isBlank()) {
            throw ValidationException.of("episode", "reason", "Reason is required");
        }

        ClinicalEpisode saved = episodeRepository.save(episode);
        log.info("Clinical episode {} opened for patient {} (appointment {})",
                saved.getId(), saved.getPatient().getName(), appointment.getId());
        return mapToEpisodeResponse(saved);
    }

    @Transactional
    public ClinicalEpisodeResponse updateEpisode(UUID id, ClinicalEpisodeRequest request) {
        ClinicalEpisode episode = findAccessibleEpisode(id);
        if (episode.isClosed()) {
            throw new InvalidStateTransitionException("episode", "CLOSED", "update");
        }

        if (request.getVeterinarianId() != null) {
            episode.setVeterinarian(findVeterinarian(request.getVeterinarianId()));
        }
        if (request.getReason() != null && !request.getReason().isBlank()) {
            episode.setReason(request.getReason());
        }
        applyClinicalFields(episode, request);

        log.info("Clinical episode {} updated", id);
        return mapToEpisodeResponse(episodeRepository.save(episode));
    }

    @Transactional
    public ClinicalEpisodeResponse closeEpisode(UUID id) {
        ClinicalEpisode episode = findAccessibleEpisode(id);
        if (episode.isClosed()) {
            throw new InvalidStateTransitionException("This episode is already closed");
        }
        episode.setClosed(true);
        log.info("Clinical episode {} closed", id);
        return mapToEpisodeResponse(episodeRepository.save(episode));
    }

    @Transactional
    public ClinicalEpisodeResponse reopenEpisode(UUID id) {
        ClinicalEpisode episode = findAccessibleEpisode(id);
        if (!episode.isClosed()) {
            throw new InvalidStateTransitionException("This episode is not closed");
        }
        episode.setClosed(false);
        log.info("Clinical episode {} reopened", id);
        return mapToEpisodeResponse(episodeRepository.save(episode));
    }

    @Transactional
    public void deleteEpisode(UUID id) {
        ClinicalEpisode episode = findEpisode(id);
        List<Attachment> attachments = attachmentRepository.findByEpisodeIdOrderByUploadedAtDesc(id);
        attachments.forEach(attachment -> FileUploadUtil.deleteFile(clinicProperties.getUploadDir(), attachment.getFilePath()));
        attachmentRepository.deleteAll(attachments);
        vitalSignsRepository.deleteAll(vitalSignsRepository.findByEpisodeIdOrderByRecordedAtDesc(id));
        episodeRepository.delete(episode);
        log.info("Clinical episode {} deleted", id);
    }

    @Transactional(readOnly = true)
    public ClinicalEpisodeResponse getEpisodeById(UUID id) {
        return mapToEpisodeResponse(findAccessibleEpisode(id));
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<ClinicalEpisodeResponse> getAllEpisodes(int page, int limit, UUID patientId,
                                                                    UUID veterinarianId, Boolean closed,
                                                                    LocalDate startDate, LocalDate endDate,
                                                                    String search) {
        User currentUser = userService.getCurrentUser();
        UUID guardianFilter = currentUser.isGuardian() ? currentUser.getId() : null;
        UUID vetFilter = currentUser.isVeterinarian() ? currentUser.getId() : veterinarianId;

        Pageable pageable = PaginationUtil.pageOf(page, limit, Sort.by("createdAt").descending());
        Page<ClinicalEpisode> episodes = episodeRepository.searchEpisodes(
                patientId, guardianFilter, vetFilter, closed,
                startDate != null ? DateUtil.getStartOfDay(startDate) : null,
                endDate != null ? DateUtil.getStartOfNextDay(endDate) : null,
                search, pageable);

        List<ClinicalEpisodeResponse> responses = episodes.getContent()
                .stream()
                .map(this::mapToEpisodeResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(responses, page, limit, episodes.getTotalElements());
    }

    /**
     * Full clinical history of a patient, newest first.
     */
    @Transactional(readOnly = true)
    public List<ClinicalEpisodeResponse> getPatientHistory(UUID patientId) {
        Patient patient = patientService.findAccessiblePatient(patientId);
        return episodeRepository.findByPatientIdOrderByCreatedAtDesc(patient.getId())
                .stream()
                .map(this::mapToEpisodeResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public VitalSignsResponse recordVitals(UUID episodeId, VitalSignsRequest request) {
        ClinicalEpisode episode = findAccessibleEpisode(episodeId);
        if (episode.isClosed()) {
            throw new InvalidStateTransitionException("episode", "CLOSED", "record vital signs for");
        }

        VitalSigns vitals = VitalSigns.builder()
                .episode(episode)
                .weight(request.getWeight())
                .temperature(request.getTemperature())
                .heartRate(request.getHeartRate())
                .respiratoryRate(request.getRespiratoryRate())
                .systolicPressure(request.getSystolicPressure())
                .diastolicPressure(request.getDiastolicPressure())
                .capillaryRefillTime(request.getCapillaryRefillTime())
                .bodyConditionScore(request.getBodyConditionScore())
                .notes(request.getNotes())
                .recordedBy(userService.getCurrentUser())
                .build();

        VitalSigns saved = vitalSignsRepository.save(vitals);
        log.info("Vital signs recorded for episode {}: weight={} temperature={}",
                episodeId, saved.getWeight(), saved.getTemperature());
        return mapToVitalSignsResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<VitalSignsResponse> getVitals(UUID episodeId) {
        ClinicalEpisode episode = findAccessibleEpisode(episodeId);
        return vitalSignsRepository.findByEpisodeIdOrderByRecordedAtDesc(episode.getId())
                .stream()
                .map(this::mapToVitalSignsResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public AttachmentResponse uploadAttachment(UUID episodeId, AttachmentType type, String title,
                                               String description, MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw ValidationException.of("attachment", "file", "File is required");
        }
        if (title == null || title.isBlank()) {
            throw ValidationException.of("attachment", "title", "Title is required");
        }
        if (!FileUploadUtil.isValidFileSize(file, Constants.MAX_FILE_SIZE_MB)) {
            throw ValidationException.of("attachment", "file",
                    "File must not exceed " + Constants.MAX_FILE_SIZE_MB + " MB");
        }
        ClinicalEpisode episode = findAccessibleEpisode(episodeId);

        String path = FileUploadUtil.saveFile(clinicProperties.getUploadDir(), file, Constants.EPISODE_ATTACHMENT_DIR);
        Attachment attachment = Attachment.builder()
                .episode(episode)
                .type(type != null ? type : AttachmentType.OTHER)
                .title(title)
                .description(description)
                .filePath(path)
                .originalFilename(file.getOriginalFilename())
                .contentType(file.getContentType())
                .fileSize(file.getSize())
                .uploadedBy(userService.getCurrentUser())
                .build();

        Attachment saved = attachmentRepository.save(attachment);
        log.info("Attachment {} ({}) added to episode {}", saved.getId(), saved.getType(), episodeId);
        return mapToAttachmentResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<AttachmentResponse> getAttachments(UUID episodeId) {
        ClinicalEpisode episode = findAccessibleEpisode(episodeId);
        return attachmentRepository.findByEpisodeIdOrderByUploadedAtDesc(episode.getId())
                .stream()
                .map(this::mapToAttachmentResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public void deleteAttachment(UUID attachmentId) {
        Attachment attachment = attachmentRepository.findById(attachmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Attachment", "id", attachmentId));
        attachmentRepository.delete(attachment);
        FileUploadUtil.deleteFile(clinicProperties.getUploadDir(), attachment.getFilePath());
        log.info("Attachment {} deleted", attachmentId);
    }

    public ClinicalEpisode findEpisode(UUID id) {
        return episodeRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("ClinicalEpisode", "id", id));
    }

    public ClinicalEpisodeResponse mapToEpisodeResponse(ClinicalEpisode episode) {
        if (episode == null) return null;

        User vet = episode.getVeterinarian();
        return ClinicalEpisodeResponse.builder()
                .id(episode.getId())
                .appointmentId(episode.getAppointment().getId())
                .appointmentScheduledAt(episode.getAppointment().getScheduledAt())
                .patientId(episode.getPatient().getId())
                .patientName(episode.getPatient().getName())
                .veterinarianId(vet != null ? vet.getId() : null)
                .veterinarianName(vet != null ? vet.getFullName() : null)
                .reason(episode.getReason())
                .history(episode.getHistory())
                .physicalExam(episode.getPhysicalExam())
                .presumptiveDiagnosis(episode.getPresumptiveDiagnosis())
                .definitiveDiagnosis(episode.getDefinitiveDiagnosis())
                .summaryDiagnosis(episode.getSummaryDiagnosis())
                .treatmentPlan(episode.getTreatmentPlan())
                .medications(episode.getMedications())
                .procedures(episode.getProcedures())
                .prognosis(episode.getPrognosis())
                .homeCareInstructions(episode.getHomeCareInstructions())
                .nextCheckUp(episode.getNextCheckUp())
                .closed(episode.isClosed())
                .createdAt(episode.getCreatedAt())
                .updatedAt(episode.getUpdatedAt())
                .build();
    }

    private VitalSignsResponse mapToVitalSignsResponse(VitalSigns vitals) {
        User recordedBy = vitals.getRecordedBy();
        return VitalSignsResponse.builder()
                .id(vitals.getId())
                .episodeId(vitals.getEpisode().getId())
                .weight(vitals.getWeight())
                .temperature(vitals.getTemperature())
                .heartRate(vitals.getHeartRate())
                .respiratoryRate(vitals.getRespiratoryRate())
                .systolicPressure(vitals.getSystolicPressure())
                .diastolicPressure(vitals.getDiastolicPressure())
                .capillaryRefillTime(vitals.getCapillaryRefillTime())
                .bodyConditionScore(vitals.getBodyConditionScore())
                .notes(vitals.getNotes())
                .recordedAt(vitals.getRecordedAt())
                .recordedById(recordedBy != null ? recordedBy.getId() : null)
                .recordedByName(recordedBy != null ? recordedBy.getFullName() : null)
                .build();
    }

    private AttachmentResponse mapToAttachmentResponse(Attachment attachment) {
        return AttachmentResponse.builder()
                .id(attachment.getId())
                .episodeId(attachment.getEpisode().getId())
                .type(attachment.getType())
                .title(attachment.getTitle())
                .description(attachment.getDescription())
                .filePath(attachment.getFilePath())
                .originalFilename(attachment.getOriginalFilename())
                .contentType(attachment.getContentType())
                .fileSize(attachment.getFileSize())
                .uploadedAt(attachment.getUploadedAt())
                .uploadedByName(attachment.getUploadedBy() != null ? attachment.getUploadedBy().getFullName() : null)
                .build();
    }

    private void applyClinicalFields(ClinicalEpisode episode, ClinicalEpisodeRequest request) {
        if (request.getHistory() != null) episode.setHistory(request.getHistory());
        if (request.getPhysicalExam() != null) episode.setPhysicalExam(request.getPhysicalExam());
        if (request.getPresumptiveDiagnosis() != null) episode.setPresumptiveDiagnosis(request.getPresumptiveDiagnosis());
        if (request.getDefinitiveDiagnosis() != null) episode.setDefinitiveDiagnosis(request.getDefinitiveDiagnosis());
        if (request.getTreatmentPlan() != null) episode.setTreatmentPlan(request.getTreatmentPlan());
        if (request.getMedications() != null) episode.setMedications(request.getMedications());
        if (request.getProcedures() != null) episode.setProcedures(request.getProcedures());
        if (request.getHomeCareInstructions() != null) episode.setHomeCareInstructions(request.getHomeCareInstructions());
        if (request.getNextCheckUp() != null) episode.setNextCheckUp(request.getNextCheckUp());
        episode.setPrognosis(request.getPrognosis() != null ? request.getPrognosis()
                : episode.getPrognosis() != null ? episode.getPrognosis() : Prognosis.GOOD);
    }

    private User findVeterinarian(UUID id) {
        User vet = userService.findUser(id);
        if (vet.getRole() != Role.VETERINARIAN) {
            throw ValidationException.of("episode", "veterinarianId", "Assigned user must have the veterinarian role");
        }
        return vet;
    }

    private ClinicalEpisode findAccessibleEpisode(UUID id) {
        ClinicalEpisode episode = findEpisode(id);
        User currentUser = userService.getCurrentUser();
        boolean visible;
        if (currentUser.isGuardian()) {
            visible = episode.getPatient().getGuardian().getId().equals(currentUser.getId());
        } else if (currentUser.isVeterinarian()) {
            visible = episode.getVeterinarian() == null || episode.getVeterinarian().getId().equals(currentUser.getId());
        } else {
            visible = true;
        }
        if (!visible) {
            throw new ResourceNotFoundException("ClinicalEpisode", "id", id);
        }
        return episode;
    }
}
