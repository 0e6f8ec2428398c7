package com.examify.common.exception;

/**
 * Base class for the application's unchecked exceptions.
 */
public class ExamifyException extends RuntimeException {

    public ExamifyException(String message) {
        super(message);
    }

    public ExamifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
