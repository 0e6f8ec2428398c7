package com.examify.core.ingestion;

import com.examify.common.constants.ProcessingStatus;
import com.examify.core.chunking.TextChunk;
import com.examify.data.entity.DocumentChunk;
import com.examify.data.entity.StudyMaterial;
import com.examify.data.repository.DocumentChunkRepository;
import com.examify.data.repository.StudyMaterialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Short transactions around ingestion. Kept apart from {@link MaterialIngestionService} so that no
 * transaction is open while the service waits on the parser or the embedding provider.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestionWriter {

    private final StudyMaterialRepository materialRepository;
    private final DocumentChunkRepository chunkRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markProcessing(UUID materialId) {
        materialRepository.updateStatus(materialId, ProcessingStatus.PROCESSING, null, Instant.now());
    }

    /**
     * Inserts every chunk and flips the material to COMPLETED in one transaction. Retrieval only
     * resolves chunks of COMPLETED materials, so readers see all of them or none.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int saveChunksAndComplete(UUID materialId, List<TextChunk> chunks, List<String> vectorIds) {
        StudyMaterial material = materialRepository.getReferenceById(materialId);

        List<DocumentChunk> entities = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            TextChunk chunk = chunks.get(i);
            entities.add(DocumentChunk.builder()
                .studyMaterial(material)
                .chunkIndex(chunk.getChunkIndex())
                .content(chunk.getContent())
                .tokenCount(chunk.getTokenCount())
                .vectorId(vectorIds.get(i))
                .reviewFlagsCount(0)
                .build());
        }
        chunkRepository.saveAllAndFlush(entities);
        materialRepository.markCompleted(materialId, entities.size(), Instant.now());

        log.info("[INGESTION] Chunks committed | materialId={} | chunks={}", materialId, entities.size());
        return entities.size();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID materialId, String errorMessage) {
        materialRepository.updateStatus(materialId, ProcessingStatus.FAILED, errorMessage, Instant.now());
    }
}
