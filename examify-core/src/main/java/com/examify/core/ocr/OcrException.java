package com.examify.core.ocr;

import com.examify.common.exception.ExamifyException;

public class OcrException extends ExamifyException {

    public OcrException(String message) {
        super(message);
    }

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
