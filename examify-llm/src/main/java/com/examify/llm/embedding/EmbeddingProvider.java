package com.examify.llm.embedding;

import com.examify.llm.provider.ProviderClient.ProviderException;

import java.util.List;

/**
 * Vendor-specific embedding call. Implementations return exactly one vector per input, in input order,
 * and never split the batch themselves.
 */
public interface EmbeddingProvider {

    List<float[]> embedBatch(List<String> texts, EmbeddingPurpose purpose) throws ProviderException;

    String getProviderName();

    int getDimension();

    int getMaxBatchSize();

    default boolean requiresApiKey() {
        return true;
    }
}
