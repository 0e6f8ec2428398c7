package com.examify.core.ocr;

import lombok.Value;

@Value
public class OcrResult {
    String text;
    /** Mean word confidence in [0, 1]; 0 when nothing was recognised. */
    double confidence;

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
