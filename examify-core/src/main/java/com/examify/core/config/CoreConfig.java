package com.examify.core.config;

import com.examify.core.chunking.ChunkingProperties;
import com.examify.core.exam.ExamProperties;
import com.examify.core.ingestion.IngestionProperties;
import com.examify.core.ledger.LedgerProperties;
import com.examify.core.ocr.OcrProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@EnableConfigurationProperties({
    ChunkingProperties.class,
    IngestionProperties.class,
    ExamProperties.class,
    LedgerProperties.class,
    OcrProperties.class
})
public class CoreConfig {
}
