package com.examify.core.query;

import com.examify.common.exception.ValidationException;
import com.examify.core.index.VectorIndexClient;
import com.examify.core.index.VectorIndexProperties;
import com.examify.core.index.VectorMatch;
import com.examify.core.query.model.RetrievalAnswer;
import com.examify.data.entity.DocumentChunk;
import com.examify.data.entity.RetrievalSession;
import com.examify.data.repository.DocumentChunkRepository;
import com.examify.data.repository.RetrievalSessionRepository;
import com.examify.llm.prompt.PromptTemplates;
import com.examify.llm.prompt.TaskType;
import com.examify.llm.service.EmbeddingService;
import com.examify.llm.service.LlmService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Answers a question from the most similar indexed chunks, or without context when none resolve.
 *
 * <p>A {@link RetrievalSession} is stored only after generation succeeded; a provider failure propagates
 * as {@link com.examify.llm.provider.ProviderClient.ProviderException} and leaves nothing behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalEngine {

    private final EmbeddingService embeddingService;
    private final VectorIndexClient vectorIndexClient;
    private final VectorIndexProperties indexProperties;
    private final DocumentChunkRepository chunkRepository;
    private final RetrievalSessionRepository sessionRepository;
    private final LlmService llmService;

    public RetrievalAnswer ask(UUID userId, String question) {
        if (question == null || question.isBlank()) {
            throw new ValidationException("Question text must not be blank");
        }
        String trimmed = question.trim();
        long startTime = System.currentTimeMillis();

        log.info("[RETRIEVAL] Starting | userId={} | questionLength={} | topK={}",
            userId, trimmed.length(), indexProperties.getTopK());

        List<DocumentChunk> context = retrieve(trimmed);
        boolean grounded = !context.isEmpty();

        long generationStart = System.currentTimeMillis();
        String answer;
        if (grounded) {
            List<String> passages = context.stream().map(DocumentChunk::getContent).collect(Collectors.toList());
            answer = llmService.generate(TaskType.ANSWER_WITH_CONTEXT, PromptTemplates.groundedAnswer(trimmed, passages));
        } else {
            log.info("[RETRIEVAL] No context resolved, answering ungrounded | userId={}", userId);
            answer = llmService.generate(TaskType.ANSWER_WITHOUT_CONTEXT, PromptTemplates.ungroundedAnswer(trimmed));
        }
        long generationMs = System.currentTimeMillis() - generationStart;

        List<UUID> usedChunkIds = context.stream().map(DocumentChunk::getId).collect(Collectors.toList());
        RetrievalSession session = sessionRepository.save(RetrievalSession.builder()
            .userId(userId)
            .queryText(trimmed)
            .answerText(answer)
            .grounded(grounded)
            .usedChunkIds(new ArrayList<>(usedChunkIds))
            .generationTimeMs(generationMs)
            .build());

        log.info("[RETRIEVAL] Completed | userId={} | sessionId={} | grounded={} | chunksUsed={} | generationMs={} | totalMs={}",
            userId, session.getId(), grounded, usedChunkIds.size(), generationMs,
            System.currentTimeMillis() - startTime);

        return RetrievalAnswer.builder()
            .answer(answer)
            .sessionId(session.getId())
            .usedChunkIds(usedChunkIds)
            .grounded(grounded)
            .build();
    }

    /**
     * Index hits resolved to committed chunks, most similar first. Hits without a chunk row (deleted,
     * or left behind by a failed ingestion) are skipped.
     */
    List<DocumentChunk> retrieve(String question) {
        float[] queryVector = embeddingService.embedQuery(question);
        List<VectorMatch> matches = vectorIndexClient.query(queryVector, indexProperties.getTopK());
        if (matches.isEmpty()) {
            return List.of();
        }

        List<String> vectorIds = matches.stream().map(VectorMatch::getChunkId).collect(Collectors.toList());
        Map<String, DocumentChunk> byVectorId = chunkRepository.findSearchableByVectorIds(vectorIds).stream()
            .collect(Collectors.toMap(DocumentChunk::getVectorId, Function.identity(), (a, b) -> a));

        List<DocumentChunk> ordered = new ArrayList<>(byVectorId.size());
        for (String vectorId : vectorIds) {
            DocumentChunk chunk = byVectorId.get(vectorId);
            if (chunk != null) {
                ordered.add(chunk);
            }
        }
        if (ordered.size() < matches.size()) {
            log.debug("[RETRIEVAL] Skipped unresolved index hits | hits={} | resolved={}",
                matches.size(), ordered.size());
        }
        return ordered;
    }
}
