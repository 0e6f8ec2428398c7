package com.examify.data.repository;

import com.examify.data.entity.ActivityEventKind;
import com.examify.data.entity.LedgerOutboxEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerOutboxRepository extends JpaRepository<LedgerOutboxEvent, UUID> {

    Optional<LedgerOutboxEvent> findByEventKindAndSourceEntityId(ActivityEventKind eventKind, UUID sourceEntityId);

    /**
     * Undelivered events created before {@code createdBefore}, oldest first.
     */
    @Query("""
        SELECT e FROM LedgerOutboxEvent e
        WHERE e.deliveredAt IS NULL AND e.createdAt < :createdBefore
        ORDER BY e.createdAt ASC
        """)
    List<LedgerOutboxEvent> findUndelivered(@Param("createdBefore") Instant createdBefore, Pageable pageable);

    @Modifying
    @Query("""
        UPDATE LedgerOutboxEvent e SET e.deliveredAt = :now
        WHERE e.eventKind = :kind AND e.sourceEntityId = :sourceId AND e.deliveredAt IS NULL
        """)
    int markDelivered(
        @Param("kind") ActivityEventKind kind,
        @Param("sourceId") UUID sourceId,
        @Param("now") Instant now
    );

    @Modifying
    @Query("""
        UPDATE LedgerOutboxEvent e
        SET e.deliveryAttempts = e.deliveryAttempts + 1, e.lastError = :error
        WHERE e.eventKind = :kind AND e.sourceEntityId = :sourceId AND e.deliveredAt IS NULL
        """)
    int recordFailure(
        @Param("kind") ActivityEventKind kind,
        @Param("sourceId") UUID sourceId,
        @Param("error") String error
    );

    long countByDeliveredAtIsNull();
}
