package com.examify.core.ingestion;

import com.examify.core.ingestion.ProcessingJobStore.ClaimedJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProcessingJobWorkerTest {

    @Mock
    private ProcessingJobStore jobStore;

    @Mock
    private MaterialIngestionService ingestionService;

    private ProcessingJobWorker worker;

    @BeforeEach
    void setUp() {
        IngestionProperties properties = new IngestionProperties();
        properties.setWorkerThreads(2);
        worker = new ProcessingJobWorker(jobStore, ingestionService, properties);
    }

    @AfterEach
    void tearDown() {
        worker.shutdown();
    }

    @Test
    void successfulIngestionCompletesTheJob() {
        ClaimedJob job = new ClaimedJob(UUID.randomUUID(), UUID.randomUUID(), 1);
        when(ingestionService.ingest(job.getMaterialId())).thenReturn(4);

        worker.processJob(job);

        verify(jobStore).complete(job.getJobId());
        verify(jobStore, never()).fail(any(), anyString());
    }

    @Test
    void failedIngestionIsRecordedOnTheJob() {
        ClaimedJob job = new ClaimedJob(UUID.randomUUID(), UUID.randomUUID(), 2);
        when(ingestionService.ingest(job.getMaterialId()))
            .thenThrow(new IngestionException(job.getMaterialId(), "embedding provider unavailable", null));

        worker.processJob(job);

        verify(jobStore).fail(job.getJobId(), "embedding provider unavailable");
        verify(jobStore, never()).complete(any());
    }

    @Test
    void cycleProcessesEveryClaimedJob() {
        ClaimedJob first = new ClaimedJob(UUID.randomUUID(), UUID.randomUUID(), 1);
        ClaimedJob second = new ClaimedJob(UUID.randomUUID(), UUID.randomUUID(), 1);
        when(jobStore.claim(anyString(), anyInt())).thenReturn(List.of(first, second));

        worker.processQueuedJobs();

        verify(jobStore).requeueExpired();
        verify(ingestionService).ingest(first.getMaterialId());
        verify(ingestionService).ingest(second.getMaterialId());
        verify(jobStore).complete(first.getJobId());
        verify(jobStore).complete(second.getJobId());
    }

    @Test
    void emptyQueueDoesNothing() {
        when(jobStore.claim(anyString(), anyInt())).thenReturn(List.of());

        worker.processQueuedJobs();

        verifyNoInteractions(ingestionService);
    }
}
