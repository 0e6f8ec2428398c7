package com.examify.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResponse {
    private UUID userId;
    private int mockExamsCompleted;
    private Double averageMockExamScore;
    private int studyMaterialsUploadedCount;
    private long totalPoints;
}
