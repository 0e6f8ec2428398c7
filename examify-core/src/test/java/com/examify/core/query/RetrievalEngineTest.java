package com.examify.core.query;

import com.examify.common.exception.ValidationException;
import com.examify.core.index.InMemoryVectorIndexClient;
import com.examify.core.index.VectorIndexProperties;
import com.examify.core.query.model.RetrievalAnswer;
import com.examify.data.entity.DocumentChunk;
import com.examify.data.entity.RetrievalSession;
import com.examify.data.repository.DocumentChunkRepository;
import com.examify.data.repository.RetrievalSessionRepository;
import com.examify.llm.prompt.TaskType;
import com.examify.llm.provider.ProviderClient.ProviderException;
import com.examify.llm.service.EmbeddingService;
import com.examify.llm.service.LlmService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetrievalEngineTest {

    private static final UUID USER = UUID.randomUUID();

    @Mock
    private EmbeddingService embeddingService;
    @Mock
    private DocumentChunkRepository chunkRepository;
    @Mock
    private RetrievalSessionRepository sessionRepository;
    @Mock
    private LlmService llmService;

    private InMemoryVectorIndexClient index;
    private RetrievalEngine engine;

    @BeforeEach
    void setUp() {
        index = new InMemoryVectorIndexClient(2);
        VectorIndexProperties properties = new VectorIndexProperties();
        properties.setTopK(2);
        engine = new RetrievalEngine(embeddingService, index, properties, chunkRepository, sessionRepository, llmService);
    }

    @Test
    void emptyIndexAnswersUngrounded() {
        when(embeddingService.embedQuery("What is osmosis?")).thenReturn(new float[]{1, 0});
        when(llmService.generate(eq(TaskType.ANSWER_WITHOUT_CONTEXT), anyString())).thenReturn("Water movement.");
        mockSessionSave();

        RetrievalAnswer answer = engine.ask(USER, "What is osmosis?");

        assertFalse(answer.isGrounded());
        assertTrue(answer.getUsedChunkIds().isEmpty());
        assertEquals("Water movement.", answer.getAnswer());
        assertNotNull(answer.getSessionId());
        verifyNoInteractions(chunkRepository);
    }

    @Test
    void groundedAnswerUsesChunksMostSimilarFirst() {
        DocumentChunk near = chunk("v-near", "Osmosis moves water across membranes.");
        DocumentChunk far = chunk("v-far", "Diffusion moves solutes.");
        index.upsert("v-far", new float[]{0, 1}, Map.of());
        index.upsert("v-near", new float[]{1, 0}, Map.of());

        when(embeddingService.embedQuery(anyString())).thenReturn(new float[]{1, 0.2f});
        when(chunkRepository.findSearchableByVectorIds(anyCollection())).thenReturn(List.of(far, near));
        when(llmService.generate(eq(TaskType.ANSWER_WITH_CONTEXT), anyString())).thenReturn("Answer [Passage 1]");
        mockSessionSave();

        RetrievalAnswer answer = engine.ask(USER, "  What is osmosis?  ");

        assertTrue(answer.isGrounded());
        assertEquals(List.of(near.getId(), far.getId()), answer.getUsedChunkIds());

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmService).generate(eq(TaskType.ANSWER_WITH_CONTEXT), prompt.capture());
        assertTrue(prompt.getValue().indexOf(near.getContent()) < prompt.getValue().indexOf(far.getContent()));
        assertTrue(prompt.getValue().contains("What is osmosis?"));
    }

    @Test
    void unresolvedHitsAreSkipped() {
        index.upsert("orphan", new float[]{1, 0}, Map.of());
        when(embeddingService.embedQuery(anyString())).thenReturn(new float[]{1, 0});
        when(chunkRepository.findSearchableByVectorIds(anyCollection())).thenReturn(List.of());
        when(llmService.generate(eq(TaskType.ANSWER_WITHOUT_CONTEXT), anyString())).thenReturn("General answer");
        mockSessionSave();

        RetrievalAnswer answer = engine.ask(USER, "Anything?");

        assertFalse(answer.isGrounded());
    }

    @Test
    void sessionRecordsUsedChunks() {
        DocumentChunk only = chunk("v1", "Content");
        index.upsert("v1", new float[]{1, 0}, Map.of());
        when(embeddingService.embedQuery(anyString())).thenReturn(new float[]{1, 0});
        when(chunkRepository.findSearchableByVectorIds(anyCollection())).thenReturn(List.of(only));
        when(llmService.generate(any(), anyString())).thenReturn("ok");
        mockSessionSave();

        engine.ask(USER, "Question");

        ArgumentCaptor<RetrievalSession> saved = ArgumentCaptor.forClass(RetrievalSession.class);
        verify(sessionRepository).save(saved.capture());
        assertEquals(USER, saved.getValue().getUserId());
        assertEquals(List.of(only.getId()), saved.getValue().getUsedChunkIds());
        assertTrue(saved.getValue().isGrounded());
        assertEquals("ok", saved.getValue().getAnswerText());
    }

    @Test
    void generationFailurePersistsNothing() {
        when(embeddingService.embedQuery(anyString())).thenReturn(new float[]{1, 0});
        when(llmService.generate(any(), anyString()))
            .thenThrow(new ProviderException("overloaded", "stub", 503, false));

        assertThrows(ProviderException.class, () -> engine.ask(USER, "Question"));
        verifyNoInteractions(sessionRepository);
    }

    @Test
    void blankQuestionIsRejected() {
        assertThrows(ValidationException.class, () -> engine.ask(USER, "   "));
        assertThrows(ValidationException.class, () -> engine.ask(USER, null));
        verifyNoInteractions(embeddingService, llmService, sessionRepository);
    }

    private void mockSessionSave() {
        when(sessionRepository.save(any(RetrievalSession.class))).thenAnswer(invocation -> {
            RetrievalSession session = invocation.getArgument(0);
            session.setId(UUID.randomUUID());
            return session;
        });
    }

    private static DocumentChunk chunk(String vectorId, String content) {
        return DocumentChunk.builder()
            .id(UUID.randomUUID())
            .vectorId(vectorId)
            .content(content)
            .chunkIndex(0)
            .build();
    }
}
