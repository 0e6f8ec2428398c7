package com.examify.core.processor.impl;

import com.examify.core.model.ExtractionResult;
import com.examify.core.processor.DocumentParsingException;
import com.examify.core.processor.DocumentProcessor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Page-by-page text layer of a PDF. Scanned PDFs without a text layer yield empty pages; they are not OCR'd.
 */
@Component
@Slf4j
public class PdfProcessor implements DocumentProcessor {

    @Override
    public boolean supports(String fileType) {
        return "pdf".equalsIgnoreCase(fileType);
    }

    @Override
    public ExtractionResult extract(InputStream inputStream, String fileType) throws IOException {
        try (PDDocument pdf = Loader.loadPDF(inputStream.readAllBytes())) {
            if (pdf.isEncrypted() && !pdf.getCurrentAccessPermission().canExtractContent()) {
                throw new DocumentParsingException("PDF is protected against text extraction");
            }

            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setLineSeparator("\n");

            int pageCount = pdf.getNumberOfPages();
            List<String> pages = new ArrayList<>(pageCount);
            int emptyPages = 0;
            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                String text = stripper.getText(pdf).strip();
                if (text.isEmpty()) {
                    emptyPages++;
                }
                pages.add(text);
            }

            if (pageCount > 0 && emptyPages == pageCount) {
                log.warn("[PARSER] PDF has no text layer | pages={}", pageCount);
            }
            return ExtractionResult.builder()
                .pageContents(pages)
                .totalPages(pageCount)
                .build();
        }
    }
}
