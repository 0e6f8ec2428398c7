package com.examify.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Progress event written in the same transaction as the change that caused it. A row with no
 * {@code deliveredAt} has not reached the user's profile yet and is picked up again later.
 */
@Entity
@Table(
    name = "ledger_outbox",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_ledger_outbox_kind_source",
        columnNames = {"event_kind", "source_entity_id"}
    ),
    indexes = @Index(name = "idx_ledger_outbox_pending", columnList = "delivered_at, created_at")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerOutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_kind", nullable = false, updatable = false, length = 32)
    private ActivityEventKind eventKind;

    @Column(name = "source_entity_id", nullable = false, updatable = false)
    private UUID sourceEntityId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    // exam events only
    @Column(name = "score", updatable = false)
    private Double score;

    @Column(name = "delivery_attempts", nullable = false)
    @Builder.Default
    private int deliveryAttempts = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public boolean isDelivered() {
        return deliveredAt != null;
    }
}
