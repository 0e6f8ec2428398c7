package com.examify.data.repository;

import com.examify.data.entity.AiFeedback;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AiFeedbackRepository extends JpaRepository<AiFeedback, UUID> {

    List<AiFeedback> findBySession_Id(UUID sessionId);
}
