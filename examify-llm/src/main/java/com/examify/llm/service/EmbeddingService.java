package com.examify.llm.service;

import com.examify.common.exception.ConfigurationException;
import com.examify.llm.config.LlmProperties;
import com.examify.llm.embedding.EmbeddingProvider;
import com.examify.llm.embedding.EmbeddingPurpose;
import com.examify.llm.provider.LlmProvider;
import com.examify.llm.provider.ProviderClient.ProviderException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Turns texts into vectors with the configured {@link EmbeddingProvider}.
 *
 * Input is split into batches of {@code examify.llm.embedding-batch-size}; batches run in parallel
 * and are reassembled by batch index, so output order always equals input order. Every returned
 * vector is checked against the provider's dimension.
 */
@Service
@Slf4j
public class EmbeddingService {

    private final EmbeddingProvider provider;
    private final ProviderRetry retry;
    private final int batchSize;
    private final ExecutorService batchExecutor;

    public EmbeddingService(List<EmbeddingProvider> providers, LlmProperties properties) {
        String wanted = LlmProvider.canonicalName(properties.getProvider());
        this.provider = providers.stream()
            .filter(p -> p.getProviderName().equals(wanted))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException(
                "No embedding provider named '" + properties.getProvider() + "', available: "
                    + providers.stream().map(EmbeddingProvider::getProviderName).collect(Collectors.joining(", "))));

        if (provider.requiresApiKey() && (properties.getApiKey() == null || properties.getApiKey().isBlank())) {
            throw new ConfigurationException("examify.llm.api-key is required for provider " + wanted);
        }
        if (provider.getDimension() <= 0) {
            throw new ConfigurationException("Embedding dimension must be positive, got " + provider.getDimension());
        }

        this.retry = new ProviderRetry(properties);
        this.batchSize = Math.max(1, Math.min(properties.getEmbeddingBatchSize(), provider.getMaxBatchSize()));
        this.batchExecutor = Executors.newFixedThreadPool(Math.max(1, properties.getEmbeddingParallelism()));

        log.info("[EMBED] Embedding provider selected | provider={} | dimension={} | batchSize={} | parallelism={}",
            provider.getProviderName(), provider.getDimension(), batchSize, properties.getEmbeddingParallelism());
    }

    public List<float[]> embed(List<String> texts) {
        return embed(texts, EmbeddingPurpose.DOCUMENT);
    }

    public float[] embedQuery(String text) {
        return embed(List.of(text), EmbeddingPurpose.QUERY).get(0);
    }

    /**
     * @return one vector per input text, same order
     * @throws ProviderException permanent; a transient failure that outlived its retries is reported as permanent
     */
    public List<float[]> embed(List<String> texts, EmbeddingPurpose purpose) {
        if (texts == null || texts.isEmpty()) {
            return Collections.emptyList();
        }

        long startTime = System.currentTimeMillis();
        List<IndexedBatch> batches = new ArrayList<>();
        for (int start = 0, index = 0; start < texts.size(); start += batchSize, index++) {
            batches.add(new IndexedBatch(index, texts.subList(start, Math.min(start + batchSize, texts.size()))));
        }

        List<IndexedResult> results;
        if (batches.size() == 1) {
            results = List.of(embedBatch(batches.get(0), purpose, 1));
        } else {
            List<CompletableFuture<IndexedResult>> futures = batches.stream()
                .map(batch -> CompletableFuture.supplyAsync(() -> embedBatch(batch, purpose, batches.size()), batchExecutor))
                .collect(Collectors.toList());
            try {
                results = futures.stream()
                    .map(CompletableFuture::join)
                    .sorted(Comparator.comparingInt(r -> r.index))
                    .collect(Collectors.toList());
            } catch (CompletionException e) {
                futures.forEach(f -> f.cancel(true));
                if (e.getCause() instanceof ProviderException pe) {
                    throw pe;
                }
                throw e;
            }
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        results.forEach(r -> vectors.addAll(r.vectors));

        log.info("[EMBED] Embedded texts | provider={} | purpose={} | texts={} | batches={} | durationMs={}",
            provider.getProviderName(), purpose, texts.size(), batches.size(), System.currentTimeMillis() - startTime);
        return vectors;
    }

    private IndexedResult embedBatch(IndexedBatch batch, EmbeddingPurpose purpose, int totalBatches) {
        String operation = "embed batch " + (batch.index + 1) + "/" + totalBatches;
        List<float[]> vectors = retry.execute(operation, () -> provider.embedBatch(batch.texts, purpose));
        verify(batch, vectors);
        return new IndexedResult(batch.index, vectors);
    }

    private void verify(IndexedBatch batch, List<float[]> vectors) {
        if (vectors == null || vectors.size() != batch.texts.size()) {
            throw new ProviderException(
                String.format("Provider returned %d vectors for %d texts",
                    vectors == null ? 0 : vectors.size(), batch.texts.size()),
                provider.getProviderName(), 502, false);
        }
        for (int i = 0; i < vectors.size(); i++) {
            float[] vector = vectors.get(i);
            if (vector == null || vector.length != provider.getDimension()) {
                throw new ProviderException(
                    String.format("Vector %d of batch %d has dimension %d, expected %d",
                        i, batch.index, vector == null ? 0 : vector.length, provider.getDimension()),
                    provider.getProviderName(), 502, false);
            }
        }
    }

    public int getDimension() {
        return provider.getDimension();
    }

    public String getProviderName() {
        return provider.getProviderName();
    }

    @PreDestroy
    public void shutdown() {
        batchExecutor.shutdownNow();
    }

    private static class IndexedBatch {
        final int index;
        final List<String> texts;

        IndexedBatch(int index, List<String> texts) {
            this.index = index;
            this.texts = texts;
        }
    }

    private static class IndexedResult {
        final int index;
        final List<float[]> vectors;

        IndexedResult(int index, List<float[]> vectors) {
            this.index = index;
            this.vectors = vectors;
        }
    }
}
