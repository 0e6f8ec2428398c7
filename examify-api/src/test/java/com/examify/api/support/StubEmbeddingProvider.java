package com.examify.api.support;

import com.examify.llm.embedding.EmbeddingProvider;
import com.examify.llm.embedding.EmbeddingPurpose;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic 8-dimensional vectors from byte histograms, so equal texts always embed identically.
 */
@Component
public class StubEmbeddingProvider implements EmbeddingProvider {

    public static final int DIMENSION = 8;

    @Override
    public List<float[]> embedBatch(List<String> texts, EmbeddingPurpose purpose) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            float[] vector = new float[DIMENSION];
            for (byte b : text.toLowerCase().getBytes(StandardCharsets.UTF_8)) {
                vector[(b & 0xff) % DIMENSION] += 1f;
            }
            vector[0] += 0.5f;
            vectors.add(vector);
        }
        return vectors;
    }

    @Override
    public String getProviderName() {
        return StubProviderClient.NAME;
    }

    @Override
    public int getDimension() {
        return DIMENSION;
    }

    @Override
    public int getMaxBatchSize() {
        return 16;
    }

    @Override
    public boolean requiresApiKey() {
        return false;
    }
}
