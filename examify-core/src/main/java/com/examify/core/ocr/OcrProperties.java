package com.examify.core.ocr;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "examify.ocr")
public class OcrProperties {

    /** Directory holding the traineddata files; falls back to TESSDATA_PREFIX. */
    private String dataPath;

    private String language = "eng";

    /** Image queries below this mean confidence are rejected. */
    private double minConfidence = 0.5;
}
