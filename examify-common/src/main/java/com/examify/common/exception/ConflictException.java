package com.examify.common.exception;

/**
 * The requested state transition collides with the current state of the resource,
 * e.g. submitting to an attempt that is already completed.
 */
public class ConflictException extends ExamifyException {

    private final Object conflictingId;

    public ConflictException(String message) {
        this(message, null);
    }

    public ConflictException(String message, Object conflictingId) {
        super(message);
        this.conflictingId = conflictingId;
    }

    public Object getConflictingId() {
        return conflictingId;
    }
}
