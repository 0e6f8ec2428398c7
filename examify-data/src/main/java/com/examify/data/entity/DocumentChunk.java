package com.examify.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "document_chunks",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_document_chunks_material_index", columnNames = {"study_material_id", "chunk_index"}),
        @UniqueConstraint(name = "uk_document_chunks_vector_id", columnNames = {"vector_id"})
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentChunk {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "study_material_id", nullable = false)
    private StudyMaterial studyMaterial;

    @Column(name = "chunk_index", nullable = false)
    private Integer chunkIndex;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    /** Key of this chunk's entry in the vector index. */
    @Column(name = "vector_id", nullable = false, length = 64)
    private String vectorId;

    @Column(name = "token_count")
    private Integer tokenCount;

    // only ever incremented, see DocumentChunkRepository#incrementReviewFlags
    @Column(name = "review_flags_count", nullable = false)
    @Builder.Default
    private Integer reviewFlagsCount = 0;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public UUID getStudyMaterialId() {
        return studyMaterial != null ? studyMaterial.getId() : null;
    }
}
