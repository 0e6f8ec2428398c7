package com.examify.core.index;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Exhaustive cosine search over a concurrent map. Contents are lost on restart; for development and tests.
 */
@Slf4j
public class InMemoryVectorIndexClient implements VectorIndexClient {

    private final int dimension;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public InMemoryVectorIndexClient(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public void upsert(String chunkId, float[] vector, Map<String, String> metadata) {
        VectorChecks.requireDimension(vector, dimension);
        entries.put(chunkId, new Entry(vector.clone(), norm(vector), metadata == null ? Map.of() : Map.copyOf(metadata)));
    }

    @Override
    public List<VectorMatch> query(float[] vector, int topK) {
        VectorChecks.requireDimension(vector, dimension);
        if (entries.isEmpty() || topK <= 0) {
            return List.of();
        }
        double queryNorm = norm(vector);
        return entries.entrySet().stream()
            .map(e -> new VectorMatch(e.getKey(), cosine(vector, queryNorm, e.getValue())))
            .sorted(Comparator.comparingDouble(VectorMatch::getScore).reversed()
                .thenComparing(VectorMatch::getChunkId))
            .limit(topK)
            .collect(Collectors.toList());
    }

    @Override
    public void remove(Collection<String> chunkIds) {
        chunkIds.forEach(entries::remove);
        log.debug("[VECTOR_INDEX] Removed entries | count={} | remaining={}", chunkIds.size(), entries.size());
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    public int size() {
        return entries.size();
    }

    public Map<String, String> metadataOf(String chunkId) {
        Entry entry = entries.get(chunkId);
        return entry == null ? null : entry.metadata;
    }

    private static double cosine(float[] query, double queryNorm, Entry entry) {
        if (queryNorm == 0 || entry.norm == 0) {
            return 0;
        }
        double dot = 0;
        for (int i = 0; i < query.length; i++) {
            dot += query[i] * entry.vector[i];
        }
        return dot / (queryNorm * entry.norm);
    }

    private static double norm(float[] vector) {
        double sum = 0;
        for (float v : vector) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }

    private static final class Entry {
        final float[] vector;
        final double norm;
        final Map<String, String> metadata;

        Entry(float[] vector, double norm, Map<String, String> metadata) {
            this.vector = vector;
            this.norm = norm;
            this.metadata = metadata;
        }
    }
}
