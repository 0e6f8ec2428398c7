package com.examify.core.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
public class ExtractionResult {
    private List<String> pageContents;
    private Integer totalPages;

    /**
     * Non-blank pages joined by a blank line, which the chunker treats as a paragraph break.
     */
    public String fullText() {
        if (pageContents == null) {
            return "";
        }
        return pageContents.stream()
            .filter(page -> page != null && !page.isBlank())
            .collect(Collectors.joining("\n\n"));
    }
}
