package com.examify.llm.embedding;

/**
 * Some vendors embed stored passages and search queries differently.
 */
public enum EmbeddingPurpose {
    DOCUMENT,
    QUERY
}
