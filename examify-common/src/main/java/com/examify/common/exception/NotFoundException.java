package com.examify.common.exception;

public class NotFoundException extends ExamifyException {

    public NotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }
}
