package com.examify.core.index;

import lombok.Value;

import java.util.Map;

@Value
public class VectorRecord {
    String chunkId;
    float[] vector;
    Map<String, String> metadata;
}
