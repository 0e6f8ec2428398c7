package com.examify.core.material;

import com.examify.common.constants.ProcessingStatus;
import com.examify.common.exception.NotFoundException;
import com.examify.common.exception.ValidationException;
import com.examify.core.chunking.ChunkingProperties;
import com.examify.core.ingestion.ProcessingJobStore;
import com.examify.core.storage.FileStorageService;
import com.examify.data.entity.DocumentChunk;
import com.examify.data.entity.StudyMaterial;
import com.examify.data.repository.DocumentChunkRepository;
import com.examify.data.repository.StudyMaterialRepository;
import com.examify.llm.prompt.TaskType;
import com.examify.llm.service.LlmService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.mock.web.MockMultipartFile;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StudyMaterialServiceTest {

    private static final UUID OWNER = UUID.randomUUID();

    @Mock
    private StudyMaterialRepository materialRepository;
    @Mock
    private DocumentChunkRepository chunkRepository;
    @Mock
    private FileStorageService fileStorageService;
    @Mock
    private ProcessingJobStore jobStore;
    @Mock
    private LlmService llmService;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private StudyMaterialService service;

    @BeforeEach
    void setUp() {
        ChunkingProperties chunking = new ChunkingProperties();
        chunking.setOverlapChars(6);
        service = new StudyMaterialService(materialRepository, chunkRepository, fileStorageService, jobStore,
            llmService, chunking, eventPublisher);
    }

    @Test
    void unsupportedFileTypeIsRejectedBeforeAnythingIsStored() {
        MockMultipartFile file = new MockMultipartFile("file", "notes.exe", "application/octet-stream", new byte[]{1, 2});

        assertThrows(ValidationException.class, () -> service.upload(OWNER, file, null, null));
        verifyNoInteractions(materialRepository, fileStorageService, jobStore, eventPublisher);
    }

    @Test
    void emptyFileIsRejected() {
        MockMultipartFile file = new MockMultipartFile("file", "notes.pdf", "application/pdf", new byte[0]);

        assertThrows(ValidationException.class, () -> service.upload(OWNER, file, null, null));
    }

    @Test
    void summarizeSendsEachPassageOnce() {
        UUID materialId = UUID.randomUUID();
        when(materialRepository.findByIdAndOwnerId(materialId, OWNER)).thenReturn(Optional.of(material(materialId)));
        when(chunkRepository.findByStudyMaterial_IdOrderByChunkIndexAsc(materialId)).thenReturn(List.of(
            DocumentChunk.builder().chunkIndex(0).content("Alpha beta gamma ").build(),
            DocumentChunk.builder().chunkIndex(1).content("gamma delta epsilon").build()
        ));
        when(llmService.generate(eq(TaskType.SUMMARIZE), anyString())).thenReturn("Summary");

        assertEquals("Summary", service.summarize(OWNER, materialId));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmService).generate(eq(TaskType.SUMMARIZE), prompt.capture());
        assertTrue(prompt.getValue().contains("Alpha beta gamma delta epsilon"));
    }

    @Test
    void summarizeRequiresCompletedMaterial() {
        UUID materialId = UUID.randomUUID();
        StudyMaterial pending = material(materialId);
        pending.setProcessingStatus(ProcessingStatus.PROCESSING);
        when(materialRepository.findByIdAndOwnerId(materialId, OWNER)).thenReturn(Optional.of(pending));

        assertThrows(ValidationException.class, () -> service.summarize(OWNER, materialId));
        verify(llmService, never()).generate(any(), anyString());
    }

    @Test
    void otherUsersMaterialIsNotFound() {
        UUID materialId = UUID.randomUUID();
        when(materialRepository.findByIdAndOwnerId(materialId, OWNER)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.getMaterial(OWNER, materialId));
    }

    @Test
    void overlapLengthFindsSharedBoundary() {
        assertEquals(6, StudyMaterialService.overlapLength("Alpha beta gamma ", "gamma delta", 6));
        assertEquals(0, StudyMaterialService.overlapLength("Alpha beta gamma ", "other text", 6));
        assertEquals(0, StudyMaterialService.overlapLength("abc", "abc", 0));
    }

    private static StudyMaterial material(UUID id) {
        return StudyMaterial.builder()
            .id(id)
            .ownerId(OWNER)
            .title("Cell Biology")
            .originalFileName("cells.pdf")
            .fileType("pdf")
            .fileSizeBytes(100L)
            .processingStatus(ProcessingStatus.COMPLETED)
            .build();
    }
}
