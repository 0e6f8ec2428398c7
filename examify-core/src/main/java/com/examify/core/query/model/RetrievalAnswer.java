package com.examify.core.query.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class RetrievalAnswer {
    String answer;
    UUID sessionId;
    /** Chunk ids in the order they were placed in the prompt; empty when ungrounded. */
    List<UUID> usedChunkIds;
    boolean grounded;
}
