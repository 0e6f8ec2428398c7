package com.examify.data.repository;

import com.examify.common.constants.ProcessingStatus;
import com.examify.data.entity.StudyMaterial;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StudyMaterialRepository extends JpaRepository<StudyMaterial, UUID> {

    Page<StudyMaterial> findByOwnerId(UUID ownerId, Pageable pageable);

    Optional<StudyMaterial> findByIdAndOwnerId(UUID id, UUID ownerId);

    long countByOwnerIdAndProcessingStatus(UUID ownerId, ProcessingStatus status);

    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE StudyMaterial m
        SET m.processingStatus = :status, m.errorMessage = :errorMessage, m.updatedAt = :now
        WHERE m.id = :id
        """)
    int updateStatus(
        @Param("id") UUID id,
        @Param("status") ProcessingStatus status,
        @Param("errorMessage") String errorMessage,
        @Param("now") Instant now
    );

    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE StudyMaterial m
        SET m.processingStatus = com.examify.common.constants.ProcessingStatus.COMPLETED,
            m.totalChunks = :totalChunks,
            m.errorMessage = NULL,
            m.processingCompletedAt = :now,
            m.updatedAt = :now
        WHERE m.id = :id
        """)
    int markCompleted(@Param("id") UUID id, @Param("totalChunks") int totalChunks, @Param("now") Instant now);
}
