package com.examify.core.query;

import com.examify.common.exception.ValidationException;
import com.examify.core.ocr.OcrProperties;
import com.examify.core.ocr.OcrProvider;
import com.examify.core.ocr.OcrResult;
import com.examify.core.query.model.RetrievalAnswer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImageQueryServiceTest {

    private static final byte[] IMAGE = new byte[]{1, 2, 3, 4};

    @Mock
    private OcrProvider ocrProvider;

    @Mock
    private RetrievalEngine retrievalEngine;

    private ImageQueryService service;
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        OcrProperties properties = new OcrProperties();
        properties.setMinConfidence(0.6);
        service = new ImageQueryService(ocrProvider, properties, retrievalEngine);
    }

    @Test
    void recognisedTextGoesThroughRetrieval() {
        RetrievalAnswer answer = RetrievalAnswer.builder()
            .answer("Mitochondria produce ATP.")
            .sessionId(UUID.randomUUID())
            .usedChunkIds(List.of())
            .grounded(false)
            .build();
        when(ocrProvider.extractText(IMAGE)).thenReturn(new OcrResult("What do mitochondria do?", 0.91));
        when(retrievalEngine.ask(userId, "What do mitochondria do?")).thenReturn(answer);

        assertSame(answer, service.ask(userId, "question.png", IMAGE));
    }

    @Test
    void lowConfidenceIsRejectedBeforeRetrieval() {
        when(ocrProvider.extractText(IMAGE)).thenReturn(new OcrResult("Wh4t d0 m1t0", 0.32));

        assertThrows(ValidationException.class, () -> service.ask(userId, "blurry.jpg", IMAGE));
        verify(retrievalEngine, never()).ask(any(), any());
    }

    @Test
    void blankRecognitionIsRejected() {
        when(ocrProvider.extractText(IMAGE)).thenReturn(new OcrResult("  ", 0.0));

        assertThrows(ValidationException.class, () -> service.ask(userId, "empty.png", IMAGE));
        verify(retrievalEngine, never()).ask(any(), any());
    }

    @Test
    void nonImageUploadNeverReachesOcr() {
        assertThrows(ValidationException.class, () -> service.ask(userId, "notes.pdf", IMAGE));
        assertThrows(ValidationException.class, () -> service.ask(userId, "question.png", new byte[0]));
        verifyNoInteractions(ocrProvider);
    }
}
