package com.examify.core.processor;

import com.examify.core.model.ExtractionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessorFactory {

    private final List<DocumentProcessor> processors;

    public DocumentProcessor getProcessor(String fileType) {
        return processors.stream()
            .filter(p -> p.supports(fileType))
            .findFirst()
            .orElseThrow(() -> new DocumentParsingException("Unsupported file type: " + fileType));
    }

    /**
     * Extracts the whole document as one string.
     *
     * @throws DocumentParsingException for unsupported types and unreadable files
     */
    public String extractText(InputStream inputStream, String fileType) {
        DocumentProcessor processor = getProcessor(fileType);
        try {
            ExtractionResult result = processor.extract(inputStream, fileType);
            log.debug("[PARSER] Extracted | fileType={} | pages={} | processor={}",
                fileType, result.getTotalPages(), processor.getClass().getSimpleName());
            return result.fullText();
        } catch (IOException | RuntimeException e) {
            if (e instanceof DocumentParsingException) {
                throw (DocumentParsingException) e;
            }
            throw new DocumentParsingException("Could not read " + fileType + " file: " + e.getMessage(), e);
        }
    }
}
