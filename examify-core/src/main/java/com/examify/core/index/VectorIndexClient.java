package com.examify.core.index;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Similarity-search store keyed by chunk vector id.
 */
public interface VectorIndexClient {

    /**
     * Inserts or replaces the entry for {@code chunkId}.
     */
    void upsert(String chunkId, float[] vector, Map<String, String> metadata);

    /**
     * Entries ordered by descending similarity; empty when the index is empty.
     */
    List<VectorMatch> query(float[] vector, int topK);

    void remove(Collection<String> chunkIds);

    int getDimension();

    default void upsertAll(List<VectorRecord> records) {
        for (VectorRecord record : records) {
            upsert(record.getChunkId(), record.getVector(), record.getMetadata());
        }
    }
}
