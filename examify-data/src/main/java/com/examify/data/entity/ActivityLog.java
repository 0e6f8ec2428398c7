package com.examify.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of awarded events. The unique key on (user, kind, source) is what
 * makes replayed events no-ops.
 */
@Entity
@Table(
    name = "activity_logs",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_activity_logs_user_kind_source",
        columnNames = {"user_id", "event_kind", "source_entity_id"}
    )
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActivityLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_kind", nullable = false, updatable = false, length = 32)
    private ActivityEventKind eventKind;

    @Column(name = "source_entity_id", nullable = false, updatable = false, length = 64)
    private String sourceEntityId;

    @Column(name = "points_awarded", nullable = false, updatable = false)
    private Integer pointsAwarded;

    @Column(name = "details", updatable = false)
    private String details;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
