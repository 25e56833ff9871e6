package com.rambopet.clinic_backend.repository;

import com.rambopet.clinic_backend.enums.AppointmentStatus;
import com.rambopet.clinic_backend.enums.AppointmentType;
import com.rambopet.clinic_backend.model.Appointment;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, UUID> {

    /**
     * Filtered listing. {@code scopeVetId} restricts rows to that veterinarian's appointments plus
     * unassigned ones; the other filters are plain equality or range checks.
     */
    @Query(value = "SELECT a FROM Appointment a JOIN a.patient p LEFT JOIN a.veterinarian v WHERE " +
            "(:patientId IS NULL OR p.id = :patientId) AND " +
            "(:guardianId IS NULL OR a.guardian.id = :guardianId) AND " +
            "(:vetId IS NULL OR v.id = :vetId) AND " +
            "(:scopeVetId IS NULL OR v IS NULL OR v.id = :scopeVetId) AND " +
            "(:status IS NULL OR a.status = :status) AND " +
            "(:type IS NULL OR a.type = :type) AND " +
            "(:from IS NULL OR a.scheduledAt >= :from) AND " +
            "(:to IS NULL OR a.scheduledAt < :to) AND " +
            "(COALESCE(:search, '') = '' OR " +
            "LOWER(p.name) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(a.reason) LIKE LOWER(CONCAT('%', :search, '%')))",
            countQuery = "SELECT COUNT(a) FROM Appointment a JOIN a.patient p LEFT JOIN a.veterinarian v WHERE " +
                    "(:patientId IS NULL OR p.id = :patientId) AND " +
                    "(:guardianId IS NULL OR a.guardian.id = :guardianId) AND " +
                    "(:vetId IS NULL OR v.id = :vetId) AND " +
                    "(:scopeVetId IS NULL OR v IS NULL OR v.id = :scopeVetId) AND " +
                    "(:status IS NULL OR a.status = :status) AND " +
                    "(:type IS NULL OR a.type = :type) AND " +
                    "(:from IS NULL OR a.scheduledAt >= :from) AND " +
                    "(:to IS NULL OR a.scheduledAt < :to) AND " +
                    "(COALESCE(:search, '') = '' OR " +
                    "LOWER(p.name) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
                    "LOWER(a.reason) LIKE LOWER(CONCAT('%', :search, '%')))")
    Page<Appointment> searchAppointments(@Param("patientId") UUID patientId,
                                         @Param("guardianId") UUID guardianId,
                                         @Param("vetId") UUID vetId,
                                         @Param("scopeVetId") UUID scopeVetId,
                                         @Param("status") AppointmentStatus status,
                                         @Param("type") AppointmentType type,
                                         @Param("from") LocalDateTime from,
                                         @Param("to") LocalDateTime to,
                                         @Param("search") String search,
                                         Pageable pageable);

    List<Appointment> findByPatientId(UUID patientId);

    List<Appointment> findByGuardianIdOrderByScheduledAtDesc(UUID guardianId);

    List<Appointment> findByGuardianIdAndStatusOrderByScheduledAtDesc(UUID guardianId, AppointmentStatus status);

    List<Appointment> findByVeterinarianIdOrderByScheduledAtDesc(UUID veterinarianId);

    List<Appointment> findByVeterinarianIdAndStatusOrderByScheduledAtDesc(UUID veterinarianId, AppointmentStatus status);

    List<Appointment> findByScheduledAtGreaterThanEqualAndScheduledAtLessThanAndStatusNotInOrderByScheduledAtAsc(
            LocalDateTime from, LocalDateTime to, Collection<AppointmentStatus> excluded);

    List<Appointment> findByVeterinarianIdAndScheduledAtGreaterThanEqualAndScheduledAtLessThanAndStatusNotInOrderByScheduledAtAsc(
            UUID veterinarianId, LocalDateTime from, LocalDateTime to, Collection<AppointmentStatus> excluded);

    @Query("SELECT a FROM Appointment a WHERE a.scheduledAt >= :from AND a.scheduledAt < :to " +
            "AND a.status IN :statuses AND a.reminderSent = false ORDER BY a.scheduledAt")
    List<Appointment> findPendingReminders(@Param("from") LocalDateTime from,
                                           @Param("to") LocalDateTime to,
                                           @Param("statuses") Collection<AppointmentStatus> statuses);

    List<Appointment> findByStatusInAndScheduledAtBefore(Collection<AppointmentStatus> statuses, LocalDateTime cutoff);

    @Query("SELECT a.status, COUNT(a) FROM Appointment a " +
            "WHERE a.scheduledAt >= :from AND a.scheduledAt < :to GROUP BY a.status")
    List<Object[]> countByStatusBetween(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);
}
