package com.examify.data.repository;

import com.examify.data.entity.AttemptStatus;
import com.examify.data.entity.MockExamAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MockExamAttemptRepository extends JpaRepository<MockExamAttempt, UUID> {

    List<MockExamAttempt> findByUserIdAndMockExam_IdAndStatusOrderByStartedAtDesc(
        UUID userId, UUID mockExamId, AttemptStatus status);

    @Query("""
        SELECT a FROM MockExamAttempt a
        JOIN FETCH a.mockExam
        WHERE a.id = :id
        """)
    Optional<MockExamAttempt> findWithExam(@Param("id") UUID id);

    /**
     * Serializes completion of one attempt. Held only for the final write, never across a grading call.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM MockExamAttempt a WHERE a.id = :id")
    Optional<MockExamAttempt> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        SELECT COUNT(a) AS completedCount, AVG(a.score) AS averageScore
        FROM MockExamAttempt a
        WHERE a.userId = :userId
          AND a.status = com.examify.data.entity.AttemptStatus.COMPLETED
        """)
    CompletedAttemptStats computeCompletedStats(@Param("userId") UUID userId);

    interface CompletedAttemptStats {
        Long getCompletedCount();

        Double getAverageScore();
    }
}
