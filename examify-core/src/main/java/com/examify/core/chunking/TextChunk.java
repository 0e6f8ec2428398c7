package com.examify.core.chunking;

import lombok.Builder;
import lombok.Value;

/**
 * One piece of a material's text, positioned by {@code chunkIndex} (0-based, contiguous).
 */
@Value
@Builder
public class TextChunk {
    String content;
    int chunkIndex;
    int tokenCount;
}
