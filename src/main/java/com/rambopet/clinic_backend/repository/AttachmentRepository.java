package com.rambopet.clinic_backend.repository;

import com.rambopet.clinic_backend.model.Attachment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AttachmentRepository extends JpaRepository<Attachment, UUID> {
    List<Attachment> findByEpisodeIdOrderByUploadedAtDesc(UUID episodeId);
}
