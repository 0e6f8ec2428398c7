package com.examify.data.repository;

import com.examify.data.entity.RetrievalSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface RetrievalSessionRepository extends JpaRepository<RetrievalSession, UUID> {

    Optional<RetrievalSession> findByIdAndUserId(UUID id, UUID userId);
}
