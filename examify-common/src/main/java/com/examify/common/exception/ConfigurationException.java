package com.examify.common.exception;

/**
 * Invalid or incomplete deployment configuration. Raised while the application context starts,
 * never while serving a request.
 */
public class ConfigurationException extends ExamifyException {

    public ConfigurationException(String message) {
        super(message);
    }
}
