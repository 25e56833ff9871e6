package com.rambopet.clinic_backend.repository;

import com.rambopet.clinic_backend.enums.Sex;
import com.rambopet.clinic_backend.model.Patient;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PatientRepository extends JpaRepository<Patient, UUID> {
    boolean existsByMicrochip(String microchip);

    boolean existsByMicrochipAndIdNot(String microchip, UUID id);

    List<Patient> findByGuardianIdAndActiveTrueOrderByNameAsc(UUID guardianId);

    @Query("SELECT p FROM Patient p WHERE " +
            "(:guardianId IS NULL OR p.guardian.id = :guardianId) AND " +
            "(:speciesId IS NULL OR p.species.id = :speciesId) AND " +
            "(:sex IS NULL OR p.sex = :sex) AND " +
            "(:active IS NULL OR p.active = :active) AND " +
            "(:deceased IS NULL OR p.deceased = :deceased) AND " +
            "(COALESCE(:search, '') = '' OR " +
            "LOWER(p.name) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(p.microchip) LIKE LOWER(CONCAT('%', :search, '%')))")
    Page<Patient> searchPatients(@Param("guardianId") UUID guardianId,
                                 @Param("speciesId") UUID speciesId,
                                 @Param("sex") Sex sex,
                                 @Param("active") Boolean active,
                                 @Param("deceased") Boolean deceased,
                                 @Param("search") String search,
                                 Pageable pageable);

    long countByActiveTrue();
}
