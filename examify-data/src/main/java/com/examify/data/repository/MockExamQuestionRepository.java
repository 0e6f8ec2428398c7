package com.examify.data.repository;

import com.examify.data.entity.MockExamQuestion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MockExamQuestionRepository extends JpaRepository<MockExamQuestion, UUID> {

    /**
     * Questions with their grounding chunk loaded, so grading can run outside a transaction.
     */
    @Query("""
        SELECT q FROM MockExamQuestion q
        LEFT JOIN FETCH q.sourceChunk
        WHERE q.mockExam.id = :examId
        ORDER BY q.orderIndex ASC
        """)
    List<MockExamQuestion> findForGrading(@Param("examId") UUID examId);
}
