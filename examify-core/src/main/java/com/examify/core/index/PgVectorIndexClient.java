package com.examify.core.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Vector index in a PostgreSQL table with a pgvector column, searched by cosine distance ({@code <=>}).
 * Writes run in their own transaction so an index write never joins a caller's transaction.
 */
@Slf4j
public class PgVectorIndexClient implements VectorIndexClient {

    private static final Pattern TABLE_NAME = Pattern.compile("[a-z_][a-z0-9_]*");

    private final EntityManager entityManager;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final int dimension;
    private final String table;

    public PgVectorIndexClient(EntityManager entityManager, TransactionTemplate transactionTemplate,
                               ObjectMapper objectMapper, VectorIndexProperties properties) {
        if (!TABLE_NAME.matcher(properties.getTable()).matches()) {
            throw new IllegalArgumentException("Invalid vector table name: " + properties.getTable());
        }
        this.entityManager = entityManager;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.dimension = properties.getDimension();
        this.table = properties.getTable();
    }

    public void createSchema() {
        transactionTemplate.executeWithoutResult(status -> {
            entityManager.createNativeQuery("CREATE EXTENSION IF NOT EXISTS vector").executeUpdate();
            entityManager.createNativeQuery(
                "CREATE TABLE IF NOT EXISTS " + table + " ("
                    + "vector_id VARCHAR(64) PRIMARY KEY, "
                    + "embedding vector(" + dimension + ") NOT NULL, "
                    + "metadata JSONB, "
                    + "updated_at TIMESTAMPTZ NOT NULL DEFAULT now())"
            ).executeUpdate();
        });
        log.info("[VECTOR_INDEX] pgvector table ready | table={} | dimension={}", table, dimension);
    }

    @Override
    public void upsert(String chunkId, float[] vector, Map<String, String> metadata) {
        VectorChecks.requireDimension(vector, dimension);
        String metadataJson = toJson(metadata);
        transactionTemplate.executeWithoutResult(status -> entityManager.createNativeQuery(
                "INSERT INTO " + table + " (vector_id, embedding, metadata, updated_at) "
                    + "VALUES (:id, CAST(:embedding AS vector), CAST(:metadata AS jsonb), now()) "
                    + "ON CONFLICT (vector_id) DO UPDATE SET "
                    + "embedding = EXCLUDED.embedding, metadata = EXCLUDED.metadata, updated_at = now()")
            .setParameter("id", chunkId)
            .setParameter("embedding", VectorChecks.toVectorLiteral(vector))
            .setParameter("metadata", metadataJson)
            .executeUpdate());
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<VectorMatch> query(float[] vector, int topK) {
        VectorChecks.requireDimension(vector, dimension);
        if (topK <= 0) {
            return List.of();
        }
        List<Object[]> rows = entityManager.createNativeQuery(
                "SELECT vector_id, 1 - (embedding <=> CAST(:embedding AS vector)) AS score "
                    + "FROM " + table + " "
                    + "ORDER BY embedding <=> CAST(:embedding AS vector) "
                    + "LIMIT :limit")
            .setParameter("embedding", VectorChecks.toVectorLiteral(vector))
            .setParameter("limit", topK)
            .getResultList();

        return rows.stream()
            .map(row -> new VectorMatch(row[0].toString(), ((Number) row[1]).doubleValue()))
            .collect(Collectors.toList());
    }

    @Override
    public void remove(Collection<String> chunkIds) {
        if (chunkIds.isEmpty()) {
            return;
        }
        Integer deleted = transactionTemplate.execute(status -> entityManager.createNativeQuery(
                "DELETE FROM " + table + " WHERE vector_id IN (:ids)")
            .setParameter("ids", chunkIds)
            .executeUpdate());
        log.info("[VECTOR_INDEX] Removed entries | requested={} | deleted={}", chunkIds.size(), deleted);
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    private String toJson(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable", e);
        }
    }
}
