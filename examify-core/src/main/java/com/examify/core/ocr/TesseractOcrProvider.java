package com.examify.core.ocr;

import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import net.sourceforge.tess4j.Word;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;

@Component
@Slf4j
public class TesseractOcrProvider implements OcrProvider {

    private final OcrProperties properties;

    public TesseractOcrProvider(OcrProperties properties) {
        this.properties = properties;
    }

    @Override
    public OcrResult extractText(byte[] imageBytes) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException e) {
            throw new OcrException("Could not read image", e);
        }
        if (image == null) {
            throw new OcrException("Unsupported or corrupt image");
        }

        // Tesseract instances are not thread-safe
        Tesseract tesseract = newTesseract();
        long startTime = System.currentTimeMillis();
        try {
            String text = tesseract.doOCR(image);
            List<Word> words = tesseract.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
            double confidence = words.isEmpty() ? 0.0
                : words.stream().mapToDouble(Word::getConfidence).average().orElse(0.0) / 100.0;

            String trimmed = text != null ? text.trim() : "";
            log.info("[OCR] Image processed | width={} | height={} | textLength={} | words={} | confidence={} | durationMs={}",
                image.getWidth(), image.getHeight(), trimmed.length(), words.size(),
                String.format("%.2f", confidence), System.currentTimeMillis() - startTime);
            return new OcrResult(trimmed, Math.max(0.0, Math.min(1.0, confidence)));
        } catch (TesseractException e) {
            String message = e.getMessage() != null ? e.getMessage() : "";
            if (message.contains("traineddata") || message.contains("TESSDATA_PREFIX")) {
                log.warn("[OCR] Tesseract language data missing | dataPath={} | language={}",
                    dataPath(), properties.getLanguage());
            }
            throw new OcrException("OCR failed: " + message, e);
        }
    }

    private Tesseract newTesseract() {
        Tesseract tesseract = new Tesseract();
        String dataPath = dataPath();
        if (dataPath != null && !dataPath.isBlank()) {
            tesseract.setDatapath(dataPath);
        }
        tesseract.setLanguage(properties.getLanguage());
        return tesseract;
    }

    private String dataPath() {
        return properties.getDataPath() != null ? properties.getDataPath() : System.getenv("TESSDATA_PREFIX");
    }
}
