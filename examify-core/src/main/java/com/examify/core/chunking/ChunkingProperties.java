package com.examify.core.chunking;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "examify.chunking")
public class ChunkingProperties {

    /** Upper bound on chunk length, in characters. */
    private int maxChars = 1000;

    /** Characters repeated at the start of each chunk from the end of the previous one. */
    private int overlapChars = 200;
}
