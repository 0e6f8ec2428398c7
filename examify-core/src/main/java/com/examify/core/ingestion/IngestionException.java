package com.examify.core.ingestion;

import com.examify.common.exception.ExamifyException;

import java.util.UUID;

public class IngestionException extends ExamifyException {

    private final UUID materialId;

    public IngestionException(UUID materialId, String message, Throwable cause) {
        super(message, cause);
        this.materialId = materialId;
    }

    public UUID getMaterialId() {
        return materialId;
    }
}
