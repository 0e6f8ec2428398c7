package com.examify.core.ocr;

/**
 * Extracts text from a single image.
 */
public interface OcrProvider {

    /**
     * @throws OcrException when the image cannot be decoded or the engine fails
     */
    OcrResult extractText(byte[] imageBytes);
}
