package com.examify.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "mock_exam_answers",
    uniqueConstraints = @UniqueConstraint(name = "uk_mock_exam_answers_attempt_question", columnNames = {"attempt_id", "question_id"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MockExamAnswer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "attempt_id", nullable = false, updatable = false)
    private MockExamAttempt attempt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "question_id", nullable = false, updatable = false)
    private MockExamQuestion question;

    @Column(name = "submitted_content", columnDefinition = "TEXT", updatable = false)
    private String submittedContent;

    @Column(name = "points_awarded", nullable = false, updatable = false)
    private Double pointsAwarded;

    /** Null for open-ended questions. */
    @Column(name = "is_correct", updatable = false)
    private Boolean correct;

    @Column(name = "feedback", columnDefinition = "TEXT", updatable = false)
    private String feedback;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
