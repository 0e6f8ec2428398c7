package com.examify.core.ingestion;

import com.examify.core.ingestion.ProcessingJobStore.ClaimedJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Background worker that drains the ingestion queue in parallel batches.
 */
@Component
@ConditionalOnProperty(prefix = "examify.ingestion", name = "worker-enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ProcessingJobWorker {

    private static final String WORKER_ID = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    private final ProcessingJobStore jobStore;
    private final MaterialIngestionService ingestionService;
    private final int batchSize;
    private final ExecutorService executorService;

    public ProcessingJobWorker(
        ProcessingJobStore jobStore,
        MaterialIngestionService ingestionService,
        IngestionProperties properties
    ) {
        this.jobStore = jobStore;
        this.ingestionService = ingestionService;
        this.batchSize = Math.max(1, properties.getWorkerThreads());
        this.executorService = Executors.newFixedThreadPool(batchSize);
    }

    @Scheduled(fixedDelayString = "${examify.ingestion.poll-interval-ms:3000}")
    public void processQueuedJobs() {
        try {
            jobStore.requeueExpired();

            List<ClaimedJob> jobs = jobStore.claim(WORKER_ID, batchSize);
            if (jobs.isEmpty()) {
                return;
            }
            log.info("[INGESTION] Claimed jobs | workerId={} | count={}", WORKER_ID, jobs.size());

            List<CompletableFuture<Void>> futures = jobs.stream()
                .map(job -> CompletableFuture.runAsync(() -> processJob(job), executorService))
                .collect(Collectors.toList());

            // locks stay ours until the whole batch is done
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        } catch (Exception e) {
            log.error("[INGESTION] Worker cycle failed | workerId={}", WORKER_ID, e);
        }
    }

    void processJob(ClaimedJob job) {
        try {
            log.info("[INGESTION] Processing job | jobId={} | materialId={} | attempt={}",
                job.getJobId(), job.getMaterialId(), job.getAttempt());
            ingestionService.ingest(job.getMaterialId());
            jobStore.complete(job.getJobId());
        } catch (Exception e) {
            log.error("[INGESTION] Job failed | jobId={} | materialId={} | error={}",
                job.getJobId(), job.getMaterialId(), e.getMessage());
            try {
                jobStore.fail(job.getJobId(), e.getMessage());
            } catch (Exception recordError) {
                log.error("[INGESTION] Could not record job failure | jobId={}", job.getJobId(), recordError);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
    }
}
