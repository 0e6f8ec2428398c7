package com.examify.core.ingestion;

import com.examify.common.constants.ProcessingStatus;
import com.examify.core.chunking.TextChunk;
import com.examify.core.chunking.TextChunker;
import com.examify.core.index.VectorIndexClient;
import com.examify.core.index.VectorRecord;
import com.examify.core.processor.DocumentProcessorFactory;
import com.examify.core.storage.FileStorageService;
import com.examify.data.entity.StudyMaterial;
import com.examify.data.repository.StudyMaterialRepository;
import com.examify.llm.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns one stored study material into indexed chunks: parse, chunk, embed, upsert vectors, commit chunks.
 *
 * <p>All-or-nothing: any failure marks the material FAILED and removes the vectors already written, and
 * chunk rows are only committed once every vector is in the index.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MaterialIngestionService {

    private final StudyMaterialRepository materialRepository;
    private final FileStorageService fileStorageService;
    private final DocumentProcessorFactory processorFactory;
    private final TextChunker textChunker;
    private final EmbeddingService embeddingService;
    private final VectorIndexClient vectorIndexClient;
    private final IngestionWriter ingestionWriter;

    /**
     * @return number of chunks committed
     * @throws IngestionException after the material has been marked FAILED
     */
    public int ingest(UUID materialId) {
        long startTime = System.currentTimeMillis();
        StudyMaterial material = materialRepository.findById(materialId)
            .orElseThrow(() -> new IngestionException(materialId, "Study material not found: " + materialId, null));

        if (material.getProcessingStatus() == ProcessingStatus.COMPLETED) {
            log.info("[INGESTION] Already ingested, skipping | materialId={}", materialId);
            return material.getTotalChunks() != null ? material.getTotalChunks() : 0;
        }

        log.info("[INGESTION] Starting | materialId={} | fileType={} | sizeBytes={}",
            materialId, material.getFileType(), material.getFileSizeBytes());
        ingestionWriter.markProcessing(materialId);

        List<String> upsertedVectorIds = new ArrayList<>();
        try {
            String text;
            try (InputStream in = fileStorageService.open(material.getFileReference())) {
                text = processorFactory.extractText(in, material.getFileType());
            }

            List<TextChunk> chunks = textChunker.chunk(text);
            if (chunks.isEmpty()) {
                log.warn("[INGESTION] No text extracted | materialId={}", materialId);
                return ingestionWriter.saveChunksAndComplete(materialId, chunks, List.of());
            }

            List<float[]> vectors = embeddingService.embed(
                chunks.stream().map(TextChunk::getContent).collect(Collectors.toList()));

            List<VectorRecord> records = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                records.add(new VectorRecord(UUID.randomUUID().toString(), vectors.get(i), Map.of(
                    "material_id", materialId.toString(),
                    "owner_id", material.getOwnerId().toString(),
                    "chunk_index", String.valueOf(chunks.get(i).getChunkIndex())
                )));
            }
            List<String> vectorIds = records.stream().map(VectorRecord::getChunkId).collect(Collectors.toList());
            // a partial batch may already be in the index when upsertAll throws
            upsertedVectorIds.addAll(vectorIds);
            vectorIndexClient.upsertAll(records);

            int saved = ingestionWriter.saveChunksAndComplete(materialId, chunks, vectorIds);
            log.info("[INGESTION] Completed | materialId={} | chunks={} | textChars={} | durationMs={}",
                materialId, saved, text.length(), System.currentTimeMillis() - startTime);
            return saved;

        } catch (Exception e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[INGESTION] Failed | materialId={} | upsertedVectors={} | durationMs={} | error={}",
                materialId, upsertedVectorIds.size(), System.currentTimeMillis() - startTime, reason, e);
            discardVectors(materialId, upsertedVectorIds);
            ingestionWriter.markFailed(materialId, reason);
            throw new IngestionException(materialId, "Ingestion failed for material " + materialId + ": " + reason, e);
        }
    }

    private void discardVectors(UUID materialId, List<String> vectorIds) {
        if (vectorIds.isEmpty()) {
            return;
        }
        try {
            vectorIndexClient.remove(vectorIds);
        } catch (RuntimeException cleanupError) {
            // orphans are harmless: retrieval ignores ids without a committed chunk row
            log.warn("[INGESTION] Could not remove orphaned vectors | materialId={} | count={} | error={}",
                materialId, vectorIds.size(), cleanupError.getMessage());
        }
    }
}
