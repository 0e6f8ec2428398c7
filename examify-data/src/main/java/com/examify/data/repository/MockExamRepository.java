package com.examify.data.repository;

import com.examify.data.entity.MockExam;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface MockExamRepository extends JpaRepository<MockExam, UUID> {

    @Query("SELECT DISTINCT e FROM MockExam e LEFT JOIN FETCH e.questions WHERE e.id = :id")
    Optional<MockExam> findWithQuestions(@Param("id") UUID id);
}
