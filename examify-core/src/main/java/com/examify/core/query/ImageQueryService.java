package com.examify.core.query;

import com.examify.common.exception.ValidationException;
import com.examify.common.util.FileUtils;
import com.examify.core.ocr.OcrProperties;
import com.examify.core.ocr.OcrProvider;
import com.examify.core.ocr.OcrResult;
import com.examify.core.query.model.RetrievalAnswer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * A question asked as a photo: one OCR call, then the regular retrieval flow on the recognised text.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImageQueryService {

    private final OcrProvider ocrProvider;
    private final OcrProperties ocrProperties;
    private final RetrievalEngine retrievalEngine;

    public RetrievalAnswer ask(UUID userId, String fileName, byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new ValidationException("Image is required");
        }
        if (!FileUtils.isValidImage(fileName, imageBytes.length)) {
            throw new ValidationException("Unsupported image type or size: " + fileName);
        }

        OcrResult ocr = ocrProvider.extractText(imageBytes);
        if (ocr.isBlank()) {
            throw new ValidationException("No text could be read from the image");
        }
        if (ocr.getConfidence() < ocrProperties.getMinConfidence()) {
            log.info("[OCR] Rejected low-confidence image | userId={} | confidence={} | threshold={}",
                userId, ocr.getConfidence(), ocrProperties.getMinConfidence());
            throw new ValidationException("The text in the image could not be read reliably, please retake the photo");
        }

        return retrievalEngine.ask(userId, ocr.getText());
    }
}
