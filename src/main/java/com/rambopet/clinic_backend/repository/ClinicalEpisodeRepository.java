package com.rambopet.clinic_backend.repository;

import com.rambopet.clinic_backend.model.ClinicalEpisode;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface ClinicalEpisodeRepository extends JpaRepository<ClinicalEpisode, UUID> {

    boolean existsByAppointmentId(UUID appointmentId);

    List<ClinicalEpisode> findByPatientIdOrderByCreatedAtDesc(UUID patientId);

    @Query("SELECT e FROM ClinicalEpisode e JOIN e.patient p LEFT JOIN e.veterinarian v WHERE " +
            "(:patientId IS NULL OR p.id = :patientId) AND " +
            "(:guardianId IS NULL OR p.guardian.id = :guardianId) AND " +
            "(:vetId IS NULL OR v.id = :vetId) AND " +
            "(:closed IS NULL OR e.closed = :closed) AND " +
            "(:from IS NULL OR e.createdAt >= :from) AND " +
            "(:to IS NULL OR e.createdAt < :to) AND " +
            "(COALESCE(:search, '') = '' OR " +
            "LOWER(p.name) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(e.reason) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(e.definitiveDiagnosis) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(e.presumptiveDiagnosis) LIKE LOWER(CONCAT('%', :search, '%')))")
    Page<ClinicalEpisode> searchEpisodes(@Param("patientId") UUID patientId,
                                         @Param("guardianId") UUID guardianId,
                                         @Param("vetId") UUID vetId,
                                         @Param("closed") Boolean closed,
                                         @Param("from") LocalDateTime from,
                                         @Param("to") LocalDateTime to,
                                         @Param("search") String search,
                                         Pageable pageable);

    long countByClosedFalse();
}
