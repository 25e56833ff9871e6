package com.rambopet.clinic_backend.repository;

import com.rambopet.clinic_backend.model.VitalSigns;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface VitalSignsRepository extends JpaRepository<VitalSigns, UUID> {
    List<VitalSigns> findByEpisodeIdOrderByRecordedAtDesc(UUID episodeId);
}
