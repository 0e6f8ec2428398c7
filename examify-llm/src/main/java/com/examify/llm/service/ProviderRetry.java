package com.examify.llm.service;

import com.examify.llm.config.LlmProperties;
import com.examify.llm.provider.ProviderClient.ProviderException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Bounded exponential backoff for provider calls: 1s, 2s, 4s ... capped at {@code maxBackoffMs}.
 * Only retryable {@link ProviderException}s are retried; anything else propagates on first failure.
 * When attempts run out the last error is rethrown as permanent.
 */
@Slf4j
public class ProviderRetry {

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;

    public ProviderRetry(LlmProperties properties) {
        this(properties.getMaxAttempts(), properties.getInitialBackoffMs(), properties.getMaxBackoffMs());
    }

    public ProviderRetry(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
        this.maxBackoffMs = Math.max(this.initialBackoffMs, maxBackoffMs);
    }

    public <T> T execute(String operation, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (ProviderException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.error("[RETRY] Giving up | operation={} | attempts={} | provider={} | statusCode={} | error={}",
                        operation, attempt, e.getProvider(), e.getStatusCode(), e.getMessage());
                    throw e.asPermanent(operation + " failed after " + attempt + " attempts: " + e.getMessage());
                }
                long delayMs = Math.min(maxBackoffMs, initialBackoffMs * (1L << (attempt - 1)));
                log.warn("[RETRY] Transient failure | operation={} | attempt={}/{} | statusCode={} | retryInMs={} | error={}",
                    operation, attempt, maxAttempts, e.getStatusCode(), delayMs, e.getMessage());
                sleep(delayMs, e);
            }
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private static void sleep(long delayMs, ProviderException pending) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw pending.asPermanent("Interrupted while waiting to retry: " + pending.getMessage());
        }
    }
}
