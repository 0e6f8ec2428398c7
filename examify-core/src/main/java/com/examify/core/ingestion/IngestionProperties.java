package com.examify.core.ingestion;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "examify.ingestion")
public class IngestionProperties {

    /** Turns the background job poller on or off. */
    private boolean workerEnabled = true;

    private long pollIntervalMs = 3000;

    /** Materials ingested concurrently by one worker. */
    private int workerThreads = 4;

    /** How long a claimed job stays invisible to other workers. */
    private int lockDurationSeconds = 600;

    /** Claims per job before it is left FAILED. */
    private int maxJobAttempts = 3;
}
