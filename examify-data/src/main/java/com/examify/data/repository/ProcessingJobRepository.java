package com.examify.data.repository;

import com.examify.data.entity.ProcessingJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProcessingJobRepository extends JpaRepository<ProcessingJob, UUID> {

    Optional<ProcessingJob> findByStudyMaterialId(UUID studyMaterialId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT pj FROM ProcessingJob pj
        WHERE pj.status = :status
          AND (pj.lockedUntil IS NULL OR pj.lockedUntil < :now)
        ORDER BY pj.createdAt ASC
        """)
    List<ProcessingJob> findClaimable(
        @Param("status") ProcessingJob.JobStatus status,
        @Param("now") Instant now,
        Pageable pageable
    );

    default List<ProcessingJob> findClaimableJobs(Instant now, Pageable pageable) {
        return findClaimable(ProcessingJob.JobStatus.QUEUED, now, pageable);
    }

    /**
     * Jobs whose worker died while holding them.
     */
    List<ProcessingJob> findByStatusAndLockedUntilBefore(ProcessingJob.JobStatus status, Instant now);
}
