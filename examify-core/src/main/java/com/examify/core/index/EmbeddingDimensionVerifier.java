package com.examify.core.index;

import com.examify.common.exception.ConfigurationException;
import com.examify.llm.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * Fails application startup when the embedding provider and the vector index disagree on vector size.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmbeddingDimensionVerifier implements InitializingBean {

    private final EmbeddingService embeddingService;
    private final VectorIndexClient vectorIndexClient;

    @Override
    public void afterPropertiesSet() {
        int embeddingDimension = embeddingService.getDimension();
        int indexDimension = vectorIndexClient.getDimension();
        if (embeddingDimension != indexDimension) {
            throw new ConfigurationException(String.format(
                "Embedding provider '%s' produces %d-dimensional vectors but the vector index is configured for %d "
                    + "(examify.vector-index.dimension)",
                embeddingService.getProviderName(), embeddingDimension, indexDimension));
        }
        log.info("[VECTOR_INDEX] Dimension check passed | provider={} | dimension={}",
            embeddingService.getProviderName(), indexDimension);
    }
}
