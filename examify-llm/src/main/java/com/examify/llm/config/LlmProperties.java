package com.examify.llm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the language-generation and embedding providers.
 */
@Data
@ConfigurationProperties(prefix = "examify.llm")
public class LlmProperties {

    /** Active vendor: gemini (alias google) or openai. */
    private String provider = "gemini";

    private String apiKey;

    /** Overrides the vendor's default chat model. */
    private String generationModel;

    /** Overrides the vendor's default embedding model. */
    private String embeddingModel;

    /** Required when a non-default embedding model is configured. */
    private Integer embeddingDimension;

    private int embeddingBatchSize = 20;

    /** Concurrent embedding batches per ingestion. */
    private int embeddingParallelism = 2;

    private int maxAttempts = 3;

    private long initialBackoffMs = 1000;

    private long maxBackoffMs = 8000;

    private int requestTimeoutSeconds = 60;

    private double temperature = 0.3;

    private int maxOutputTokens = 2048;

    /** Base URL overrides, mostly for proxies and tests. */
    private String geminiBaseUrl;

    private String openaiBaseUrl;
}
