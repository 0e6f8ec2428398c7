package com.examify.data.repository;

import com.examify.common.constants.ProcessingStatus;
import com.examify.data.entity.DocumentChunk;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, UUID> {

    List<DocumentChunk> findByStudyMaterial_IdOrderByChunkIndexAsc(UUID studyMaterialId);

    long countByStudyMaterial_Id(UUID studyMaterialId);

    /**
     * Resolve index hits to chunks, restricted to materials whose ingestion committed.
     */
    @Query("""
        SELECT c FROM DocumentChunk c
        JOIN FETCH c.studyMaterial m
        WHERE c.vectorId IN :vectorIds
          AND m.processingStatus = :status
        """)
    List<DocumentChunk> findByVectorIdsAndMaterialStatus(
        @Param("vectorIds") Collection<String> vectorIds,
        @Param("status") ProcessingStatus status
    );

    default List<DocumentChunk> findSearchableByVectorIds(Collection<String> vectorIds) {
        return findByVectorIdsAndMaterialStatus(vectorIds, ProcessingStatus.COMPLETED);
    }

    /**
     * Single-statement increment so concurrent feedback on the same chunk is never lost.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE DocumentChunk c
        SET c.reviewFlagsCount = c.reviewFlagsCount + 1
        WHERE c.id IN :chunkIds
        """)
    int incrementReviewFlags(@Param("chunkIds") Collection<UUID> chunkIds);

    @Query("SELECT c.reviewFlagsCount FROM DocumentChunk c WHERE c.id = :id")
    Integer findReviewFlagsCount(@Param("id") UUID id);
}
