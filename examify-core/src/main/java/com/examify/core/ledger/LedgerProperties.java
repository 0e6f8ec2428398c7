package com.examify.core.ledger;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "examify.ledger")
public class LedgerProperties {

    private int examCompletedPoints = 25;

    private int materialUploadedPoints = 10;

    /** Turns the outbox redelivery poller on or off. */
    private boolean redeliveryEnabled = true;

    private long redeliveryIntervalMs = 30000;

    /** Minimum age of an undelivered entry before the poller takes it over from the listener. */
    private long redeliveryDelaySeconds = 30;

    private int redeliveryBatchSize = 50;
}
