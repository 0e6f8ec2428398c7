package com.examify.data.repository;

import com.examify.data.entity.ActivityEventKind;
import com.examify.data.entity.ActivityLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ActivityLogRepository extends JpaRepository<ActivityLog, UUID> {

    boolean existsByUserIdAndEventKindAndSourceEntityId(UUID userId, ActivityEventKind eventKind, String sourceEntityId);

    List<ActivityLog> findByUserIdOrderByCreatedAtDesc(UUID userId);

    long countByUserIdAndEventKind(UUID userId, ActivityEventKind eventKind);
}
