package com.examify.core.index;

import lombok.Value;

@Value
public class VectorMatch {
    String chunkId;
    double score;
}
