package com.examify.core.ingestion;

import com.examify.data.entity.ProcessingJob;
import com.examify.data.entity.ProcessingJob.JobStatus;
import com.examify.data.repository.ProcessingJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Job queue state transitions. Each method is its own short transaction so the worker never holds a
 * row lock while a material is being parsed or embedded.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProcessingJobStore {

    private final ProcessingJobRepository jobRepository;
    private final IngestionProperties properties;

    @Transactional
    public ProcessingJob enqueue(UUID materialId) {
        return jobRepository.findByStudyMaterialId(materialId)
            .orElseGet(() -> jobRepository.save(ProcessingJob.builder()
                .studyMaterialId(materialId)
                .status(JobStatus.QUEUED)
                .build()));
    }

    /**
     * Locks up to {@code limit} queued jobs for {@code workerId} and returns them.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<ClaimedJob> claim(String workerId, int limit) {
        Instant now = Instant.now();
        List<ProcessingJob> jobs = jobRepository.findClaimableJobs(now, PageRequest.of(0, limit));

        List<ClaimedJob> claimed = new ArrayList<>(jobs.size());
        for (ProcessingJob job : jobs) {
            job.setStatus(JobStatus.RUNNING);
            job.setLockedBy(workerId);
            job.setLockedUntil(now.plusSeconds(properties.getLockDurationSeconds()));
            job.setStartedAt(now);
            job.setAttempts(job.getAttempts() + 1);
            claimed.add(new ClaimedJob(job.getId(), job.getStudyMaterialId(), job.getAttempts()));
        }
        jobRepository.saveAllAndFlush(jobs);
        return claimed;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void complete(UUID jobId) {
        jobRepository.findById(jobId).ifPresent(job -> {
            job.setStatus(JobStatus.COMPLETED);
            job.setFinishedAt(Instant.now());
            job.setLockedBy(null);
            job.setLockedUntil(null);
            job.setLastError(null);
        });
    }

    /**
     * Requeues the job while it has attempts left, otherwise leaves it FAILED.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void fail(UUID jobId, String errorMessage) {
        ProcessingJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("[INGESTION] Job vanished before failure could be recorded | jobId={}", jobId);
            return;
        }
        job.setLastError(errorMessage);
        job.setLockedBy(null);
        job.setLockedUntil(null);
        if (job.getAttempts() >= properties.getMaxJobAttempts()) {
            job.setStatus(JobStatus.FAILED);
            job.setFinishedAt(Instant.now());
            log.warn("[INGESTION] Job failed permanently | jobId={} | materialId={} | attempts={}",
                jobId, job.getStudyMaterialId(), job.getAttempts());
        } else {
            job.setStatus(JobStatus.QUEUED);
            log.info("[INGESTION] Job requeued | jobId={} | attempt={}/{}",
                jobId, job.getAttempts(), properties.getMaxJobAttempts());
        }
    }

    /**
     * Puts RUNNING jobs whose lock has expired back in the queue.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int requeueExpired() {
        List<ProcessingJob> stale = jobRepository.findByStatusAndLockedUntilBefore(JobStatus.RUNNING, Instant.now());
        for (ProcessingJob job : stale) {
            log.warn("[INGESTION] Releasing expired lock | jobId={} | lockedBy={} | lockedUntil={}",
                job.getId(), job.getLockedBy(), job.getLockedUntil());
            job.setStatus(JobStatus.QUEUED);
            job.setLockedBy(null);
            job.setLockedUntil(null);
        }
        return stale.size();
    }

    @Value
    public static class ClaimedJob {
        UUID jobId;
        UUID materialId;
        int attempt;
    }
}
