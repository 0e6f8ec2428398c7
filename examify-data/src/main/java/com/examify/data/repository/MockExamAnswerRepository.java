package com.examify.data.repository;

import com.examify.data.entity.MockExamAnswer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MockExamAnswerRepository extends JpaRepository<MockExamAnswer, UUID> {

    @Query("""
        SELECT a FROM MockExamAnswer a
        JOIN FETCH a.question q
        WHERE a.attempt.id = :attemptId
        ORDER BY q.orderIndex ASC
        """)
    List<MockExamAnswer> findByAttemptId(@Param("attemptId") UUID attemptId);

    long countByAttempt_Id(UUID attemptId);
}
