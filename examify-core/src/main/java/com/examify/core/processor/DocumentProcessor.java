package com.examify.core.processor;

import com.examify.core.model.ExtractionResult;

import java.io.IOException;
import java.io.InputStream;

public interface DocumentProcessor {
    boolean supports(String fileType);
    ExtractionResult extract(InputStream inputStream, String fileType) throws IOException;
}
