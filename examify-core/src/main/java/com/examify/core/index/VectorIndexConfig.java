package com.examify.core.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Picks the vector index implementation from {@code examify.vector-index.type}:
 * <ul>
 *   <li>{@code in-memory} (default): process-local, for development and tests</li>
 *   <li>{@code pgvector}: PostgreSQL with the pgvector extension</li>
 * </ul>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(VectorIndexProperties.class)
public class VectorIndexConfig {

    @Bean
    @ConditionalOnProperty(name = "examify.vector-index.type", havingValue = "in-memory", matchIfMissing = true)
    public VectorIndexClient inMemoryVectorIndexClient(VectorIndexProperties properties) {
        log.info("[VECTOR_INDEX] Using in-memory index | dimension={}", properties.getDimension());
        return new InMemoryVectorIndexClient(properties.getDimension());
    }

    @Bean
    @ConditionalOnProperty(name = "examify.vector-index.type", havingValue = "pgvector")
    public VectorIndexClient pgVectorIndexClient(EntityManager entityManager,
                                                 PlatformTransactionManager transactionManager,
                                                 ObjectMapper objectMapper,
                                                 VectorIndexProperties properties) {
        log.info("[VECTOR_INDEX] Using pgvector index | table={} | dimension={}",
            properties.getTable(), properties.getDimension());
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        PgVectorIndexClient client = new PgVectorIndexClient(entityManager, template, objectMapper, properties);
        client.createSchema();
        return client;
    }
}
