package com.examify.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One answered question, kept so that feedback can later be tied to the exact chunks the answer used.
 */
@Entity
@Table(name = "retrieval_sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetrievalSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "query_text", nullable = false, columnDefinition = "TEXT")
    private String queryText;

    @Column(name = "answer_text", nullable = false, columnDefinition = "TEXT")
    private String answerText;

    @Column(name = "grounded", nullable = false)
    private boolean grounded;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "retrieval_session_chunks", joinColumns = @JoinColumn(name = "session_id"))
    @OrderColumn(name = "position")
    @Column(name = "chunk_id", nullable = false)
    @Builder.Default
    private List<UUID> usedChunkIds = new ArrayList<>();

    @Column(name = "generation_time_ms")
    private Long generationTimeMs;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
