package com.examify.api.feedback;

import com.examify.api.support.StubProviderClient;
import com.examify.common.constants.ProcessingStatus;
import com.examify.common.exception.NotFoundException;
import com.examify.common.exception.ValidationException;
import com.examify.core.feedback.FeedbackService;
import com.examify.core.ingestion.MaterialIngestionService;
import com.examify.core.ledger.ProgressLedger;
import com.examify.core.material.StudyMaterialService;
import com.examify.core.query.RetrievalEngine;
import com.examify.core.query.model.RetrievalAnswer;
import com.examify.data.entity.DocumentChunk;
import com.examify.data.entity.StudyMaterial;
import com.examify.data.repository.DocumentChunkRepository;
import com.examify.data.repository.StudyMaterialRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class RetrievalFeedbackFlowTest {

    private static final String NOTES = String.join("\n\n",
        "Photosynthesis converts light energy into chemical energy stored in glucose. It takes place in the "
            + "chloroplasts of plant cells, where chlorophyll absorbs mostly red and blue light.",
        "The light-dependent reactions happen in the thylakoid membranes. They split water, release oxygen "
            + "and produce ATP and NADPH that power the next stage.",
        "The Calvin cycle runs in the stroma. It fixes carbon dioxide into three-carbon sugars using the ATP "
            + "and NADPH made by the light-dependent reactions.");

    @Autowired
    private StudyMaterialService materialService;

    @Autowired
    private MaterialIngestionService ingestionService;

    @Autowired
    private RetrievalEngine retrievalEngine;

    @Autowired
    private FeedbackService feedbackService;

    @Autowired
    private ProgressLedger progressLedger;

    @Autowired
    private StudyMaterialRepository materialRepository;

    @Autowired
    private DocumentChunkRepository chunkRepository;

    @Autowired
    private StubProviderClient stubProvider;

    private UUID userId;

    @BeforeEach
    void setUp() {
        stubProvider.reset();
        userId = UUID.randomUUID();
    }

    @Test
    void uploadIngestAskAndRateLowFlagsTheUsedChunks() {
        StudyMaterial uploaded = materialService.upload(userId, notesFile(), "Photosynthesis notes", "BIO-101");
        assertEquals(ProcessingStatus.PENDING, uploaded.getProcessingStatus());
        assertEquals(1, progressLedger.getProfile(userId).getStudyMaterialsUploadedCount());
        assertEquals(10L, progressLedger.getProfile(userId).getTotalPoints());

        int chunks = ingestionService.ingest(uploaded.getId());
        assertTrue(chunks > 0);
        StudyMaterial ingested = materialRepository.findById(uploaded.getId()).orElseThrow();
        assertEquals(ProcessingStatus.COMPLETED, ingested.getProcessingStatus());
        assertEquals(chunks, ingested.getTotalChunks());

        stubProvider.reply("The Calvin cycle fixes carbon dioxide [Passage 1].");
        RetrievalAnswer answer = retrievalEngine.ask(userId, "  Where does the Calvin cycle run?  ");
        assertTrue(answer.isGrounded());
        assertFalse(answer.getUsedChunkIds().isEmpty());
        assertEquals("The Calvin cycle fixes carbon dioxide [Passage 1].", answer.getAnswer());
        assertTrue(stubProvider.getPrompts().get(0).contains("QUESTION: Where does the Calvin cycle run?"));

        Map<UUID, Integer> before = flagCounts(answer.getUsedChunkIds());
        feedbackService.submitFeedback(userId, answer.getSessionId(), 1, "Wrong stage", false, null);

        Map<UUID, Integer> after = flagCounts(answer.getUsedChunkIds());
        for (UUID chunkId : answer.getUsedChunkIds()) {
            assertEquals(before.get(chunkId) + 1, after.get(chunkId));
        }

        feedbackService.submitFeedback(userId, answer.getSessionId(), 5, "Great", false, null);
        assertEquals(after, flagCounts(answer.getUsedChunkIds()));
    }

    @Test
    void lowConfidenceFlagsOnlyTheChunksNamedInTheFeedback() {
        StudyMaterial uploaded = materialService.upload(userId, notesFile(), "Photosynthesis notes", null);
        ingestionService.ingest(uploaded.getId());
        List<UUID> materialChunks = chunkRepository.findByStudyMaterial_IdOrderByChunkIndexAsc(uploaded.getId())
            .stream().map(DocumentChunk::getId).collect(Collectors.toList());
        RetrievalAnswer answer = retrievalEngine.ask(userId, "What does chlorophyll absorb?");

        UUID named = materialChunks.get(0);
        int before = chunkRepository.findReviewFlagsCount(named);
        feedbackService.submitFeedback(userId, answer.getSessionId(), 4, null, true, List.of(named));

        assertEquals(before + 1, chunkRepository.findReviewFlagsCount(named));
    }

    @Test
    void feedbackIsValidated() {
        StudyMaterial uploaded = materialService.upload(userId, notesFile(), "Photosynthesis notes", null);
        ingestionService.ingest(uploaded.getId());
        RetrievalAnswer answer = retrievalEngine.ask(userId, "What do the light reactions produce?");

        assertThrows(ValidationException.class, () ->
            feedbackService.submitFeedback(userId, answer.getSessionId(), 6, null, false, null));
        assertThrows(ValidationException.class, () ->
            feedbackService.submitFeedback(userId, answer.getSessionId(), 2, null, false, List.of(UUID.randomUUID())));
        assertThrows(NotFoundException.class, () ->
            feedbackService.submitFeedback(UUID.randomUUID(), answer.getSessionId(), 2, null, false, null));
    }

    @Test
    void blankQuestionIsRejected() {
        assertThrows(ValidationException.class, () -> retrievalEngine.ask(userId, "   "));
        assertTrue(stubProvider.getPrompts().isEmpty());
    }

    private MockMultipartFile notesFile() {
        return new MockMultipartFile("file", "photosynthesis.txt", "text/plain", NOTES.getBytes(StandardCharsets.UTF_8));
    }

    private Map<UUID, Integer> flagCounts(List<UUID> chunkIds) {
        Map<UUID, Integer> counts = new HashMap<>();
        for (UUID id : chunkIds) {
            counts.put(id, chunkRepository.findReviewFlagsCount(id));
        }
        return counts;
    }
}
