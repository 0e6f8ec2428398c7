package com.examify.core.processor.impl;

import com.examify.core.model.ExtractionResult;
import com.examify.core.processor.DocumentProcessor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Word documents have no page model in POI, so the body comes back as a single page
 * with one line per paragraph.
 */
@Component
public class DocxProcessor implements DocumentProcessor {

    @Override
    public boolean supports(String fileType) {
        return "docx".equalsIgnoreCase(fileType);
    }

    @Override
    public ExtractionResult extract(InputStream inputStream, String fileType) throws IOException {
        try (XWPFDocument document = new XWPFDocument(inputStream)) {
            StringBuilder text = new StringBuilder();
            for (XWPFParagraph paragraph : document.getParagraphs()) {
                String paragraphText = paragraph.getText();
                if (paragraphText != null && !paragraphText.isBlank()) {
                    text.append(paragraphText.strip()).append("\n\n");
                }
            }
            return ExtractionResult.builder()
                .pageContents(List.of(text.toString().strip()))
                .totalPages(1)
                .build();
        }
    }
}
