package com.examify.core.processor;

import com.examify.common.exception.ExamifyException;

/**
 * The file could not be turned into text. Never retried: the same bytes fail the same way.
 */
public class DocumentParsingException extends ExamifyException {

    public DocumentParsingException(String message) {
        super(message);
    }

    public DocumentParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
