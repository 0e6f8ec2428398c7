package com.examify.data.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Aggregate study statistics per user. Rows are only written through the
 * atomic statements in {@code UserProfileRepository}.
 */
@Entity
@Table(name = "user_profiles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserProfile {

    @Id
    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "mock_exams_completed", nullable = false)
    private Integer mockExamsCompleted;

    @Column(name = "average_mock_exam_score")
    private Double averageMockExamScore;

    @Column(name = "study_materials_uploaded_count", nullable = false)
    private Integer studyMaterialsUploadedCount;

    @Column(name = "total_points", nullable = false)
    private Long totalPoints;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
