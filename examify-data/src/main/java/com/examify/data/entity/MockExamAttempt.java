package com.examify.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * One user's run of one exam. {@code score} and {@code completedAt} are set exactly when the
 * status moves to {@link AttemptStatus#COMPLETED}.
 */
@Entity
@Table(name = "mock_exam_attempts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MockExamAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "mock_exam_id", nullable = false)
    private MockExam mockExam;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    @Builder.Default
    private AttemptStatus status = AttemptStatus.IN_PROGRESS;

    @Column(name = "score")
    private Double score;

    @CreationTimestamp
    @Column(name = "started_at", updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public boolean isInProgress() {
        return status == AttemptStatus.IN_PROGRESS;
    }

    public UUID getMockExamId() {
        return mockExam != null ? mockExam.getId() : null;
    }

    public void complete(double totalScore, Instant at) {
        this.status = AttemptStatus.COMPLETED;
        this.score = totalScore;
        this.completedAt = at;
    }
}
