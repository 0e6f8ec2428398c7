package com.examify.common.exception;

/**
 * Malformed caller input, rejected before any external call is made.
 */
public class ValidationException extends ExamifyException {

    public ValidationException(String message) {
        super(message);
    }
}
