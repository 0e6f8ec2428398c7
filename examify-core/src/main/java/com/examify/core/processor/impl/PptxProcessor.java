package com.examify.core.processor.impl;

import com.examify.core.model.ExtractionResult;
import com.examify.core.processor.DocumentProcessor;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

@Component
public class PptxProcessor implements DocumentProcessor {

    @Override
    public boolean supports(String fileType) {
        return "pptx".equalsIgnoreCase(fileType);
    }

    @Override
    public ExtractionResult extract(InputStream inputStream, String fileType) throws IOException {
        try (XMLSlideShow slideShow = new XMLSlideShow(inputStream)) {
            List<String> slides = new ArrayList<>();
            for (XSLFSlide slide : slideShow.getSlides()) {
                StringBuilder slideText = new StringBuilder();
                for (XSLFShape shape : slide.getShapes()) {
                    if (shape instanceof XSLFTextShape textShape) {
                        String text = textShape.getText();
                        if (text != null && !text.isBlank()) {
                            slideText.append(text.strip()).append("\n");
                        }
                    }
                }
                slides.add(slideText.toString().strip());
            }
            return ExtractionResult.builder()
                .pageContents(slides)
                .totalPages(slides.size())
                .build();
        }
    }
}
