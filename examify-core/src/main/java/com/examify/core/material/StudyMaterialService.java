package com.examify.core.material;

import com.examify.common.constants.ProcessingStatus;
import com.examify.common.exception.NotFoundException;
import com.examify.common.exception.ValidationException;
import com.examify.common.util.FileUtils;
import com.examify.core.chunking.ChunkingProperties;
import com.examify.core.event.MaterialUploadedEvent;
import com.examify.core.ingestion.ProcessingJobStore;
import com.examify.core.storage.FileStorageService;
import com.examify.data.entity.DocumentChunk;
import com.examify.data.entity.StudyMaterial;
import com.examify.data.repository.DocumentChunkRepository;
import com.examify.data.repository.StudyMaterialRepository;
import com.examify.llm.prompt.PromptTemplates;
import com.examify.llm.prompt.TaskType;
import com.examify.llm.service.LlmService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class StudyMaterialService {

    /** Upper bound on chunk text sent to a single summarize call. */
    static final int SUMMARY_CHAR_BUDGET = 30_000;

    private final StudyMaterialRepository materialRepository;
    private final DocumentChunkRepository chunkRepository;
    private final FileStorageService fileStorageService;
    private final ProcessingJobStore jobStore;
    private final LlmService llmService;
    private final ChunkingProperties chunkingProperties;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Registers the material, stores the file and queues it for ingestion. The upload event reaches
     * listeners only once this transaction has committed.
     */
    @Transactional
    public StudyMaterial upload(UUID ownerId, MultipartFile file, String title, String courseId) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("File is required");
        }
        String originalName = file.getOriginalFilename();
        if (!FileUtils.isValidMaterial(originalName, file.getSize())) {
            throw new ValidationException("Unsupported file type or size: " + originalName);
        }

        StudyMaterial material = materialRepository.save(StudyMaterial.builder()
            .ownerId(ownerId)
            .courseId(courseId)
            .title(title != null && !title.isBlank() ? title.trim() : FileUtils.baseName(originalName))
            .originalFileName(originalName)
            .fileType(FileUtils.getFileExtension(originalName))
            .fileSizeBytes(file.getSize())
            .processingStatus(ProcessingStatus.PENDING)
            .build());

        String fileReference;
        try {
            fileReference = fileStorageService.store(file, material.getId());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store file for material " + material.getId(), e);
        }
        material.setFileReference(fileReference);
        deleteFileOnRollback(material.getId(), fileReference);

        jobStore.enqueue(material.getId());
        eventPublisher.publishEvent(new MaterialUploadedEvent(material.getId(), ownerId));

        log.info("[MATERIAL] Uploaded | materialId={} | ownerId={} | fileType={} | sizeBytes={}",
            material.getId(), ownerId, material.getFileType(), material.getFileSizeBytes());
        return material;
    }

    private void deleteFileOnRollback(UUID materialId, String fileReference) {
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_ROLLED_BACK) {
                    return;
                }
                try {
                    fileStorageService.delete(fileReference);
                } catch (IOException e) {
                    log.warn("[MATERIAL] Could not delete file of rolled back upload | materialId={} | reference={} | error={}",
                        materialId, fileReference, e.getMessage());
                }
            }
        });
    }

    @Transactional(readOnly = true)
    public StudyMaterial getMaterial(UUID ownerId, UUID materialId) {
        return materialRepository.findByIdAndOwnerId(materialId, ownerId)
            .orElseThrow(() -> new NotFoundException("StudyMaterial", materialId));
    }

    @Transactional(readOnly = true)
    public Page<StudyMaterial> listMaterials(UUID ownerId, Pageable pageable) {
        return materialRepository.findByOwnerId(ownerId, pageable);
    }

    /**
     * Summarizes an ingested material from its chunks, in order, cut off at {@link #SUMMARY_CHAR_BUDGET}.
     * Overlapping prefixes are dropped so each passage is sent once.
     */
    public String summarize(UUID ownerId, UUID materialId) {
        StudyMaterial material = getMaterial(ownerId, materialId);
        if (material.getProcessingStatus() != ProcessingStatus.COMPLETED) {
            throw new ValidationException("Material is not ready yet, status: " + material.getProcessingStatus());
        }

        List<DocumentChunk> chunks = chunkRepository.findByStudyMaterial_IdOrderByChunkIndexAsc(materialId);
        if (chunks.isEmpty()) {
            throw new ValidationException("Material has no extractable text");
        }

        StringBuilder text = new StringBuilder();
        String previous = null;
        for (DocumentChunk chunk : chunks) {
            String content = chunk.getContent();
            if (previous != null) {
                content = content.substring(overlapLength(previous, content, chunkingProperties.getOverlapChars()));
            }
            int room = SUMMARY_CHAR_BUDGET - text.length();
            if (room <= 0) {
                break;
            }
            text.append(content.length() > room ? content.substring(0, room) : content);
            previous = chunk.getContent();
        }

        long startTime = System.currentTimeMillis();
        String summary = llmService.generate(TaskType.SUMMARIZE,
            PromptTemplates.summarize(material.getTitle(), text.toString()));
        log.info("[MATERIAL] Summarized | materialId={} | chunks={} | inputChars={} | durationMs={}",
            materialId, chunks.size(), text.length(), System.currentTimeMillis() - startTime);
        return summary;
    }

    /**
     * {@code overlap} when {@code next} starts with the last {@code overlap} characters of {@code previous},
     * otherwise 0 (chunks written under a different overlap setting).
     */
    static int overlapLength(String previous, String next, int overlap) {
        if (overlap <= 0 || previous.length() < overlap || next.length() < overlap) {
            return 0;
        }
        return previous.regionMatches(previous.length() - overlap, next, 0, overlap) ? overlap : 0;
    }
}
