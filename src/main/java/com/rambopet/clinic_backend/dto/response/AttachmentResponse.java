package com.rambopet.clinic_backend.dto.response;

import com.rambopet.clinic_backend.enums.AttachmentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttachmentResponse {
    private UUID id;
    private UUID episodeId;
    private AttachmentType type;
    private String title;
    private String description;
    private String filePath;
    private String originalFilename;
    private String contentType;
    private long fileSize;
    private LocalDateTime uploadedAt;
    private String uploadedByName;
}
