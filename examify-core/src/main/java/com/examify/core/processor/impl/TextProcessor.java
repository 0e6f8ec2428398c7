package com.examify.core.processor.impl;

import com.examify.core.model.ExtractionResult;
import com.examify.core.processor.DocumentProcessor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

@Component
public class TextProcessor implements DocumentProcessor {

    @Override
    public boolean supports(String fileType) {
        return "txt".equalsIgnoreCase(fileType) || "md".equalsIgnoreCase(fileType);
    }

    @Override
    public ExtractionResult extract(InputStream inputStream, String fileType) throws IOException {
        String content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        // normalise Windows line endings so paragraph detection sees "\n\n"
        content = content.replace("\r\n", "\n");
        return ExtractionResult.builder()
            .pageContents(List.of(content))
            .totalPages(1)
            .build();
    }
}
