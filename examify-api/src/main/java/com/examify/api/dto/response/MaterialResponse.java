package com.examify.api.dto.response;

import com.examify.common.constants.ProcessingStatus;
import com.examify.data.entity.StudyMaterial;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MaterialResponse {
    private UUID id;
    private String title;
    private String courseId;
    private String originalFileName;
    private String fileType;
    private Long fileSizeBytes;
    private Integer totalChunks;
    private ProcessingStatus processingStatus;
    private String errorMessage;
    private Instant createdAt;
    private Instant processingCompletedAt;

    public static MaterialResponse from(StudyMaterial material) {
        return MaterialResponse.builder()
            .id(material.getId())
            .title(material.getTitle())
            .courseId(material.getCourseId())
            .originalFileName(material.getOriginalFileName())
            .fileType(material.getFileType())
            .fileSizeBytes(material.getFileSizeBytes())
            .totalChunks(material.getTotalChunks())
            .processingStatus(material.getProcessingStatus())
            .errorMessage(material.getErrorMessage())
            .createdAt(material.getCreatedAt())
            .processingCompletedAt(material.getProcessingCompletedAt())
            .build();
    }
}
