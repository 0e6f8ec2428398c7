package com.examify.core.index;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "examify.vector-index")
public class VectorIndexProperties {

    /** in-memory or pgvector */
    private String type = "in-memory";

    /** Must equal the embedding provider's vector size. */
    private int dimension = 768;

    /** Chunks retrieved per question. */
    private int topK = 5;

    private String table = "chunk_vectors";
}
