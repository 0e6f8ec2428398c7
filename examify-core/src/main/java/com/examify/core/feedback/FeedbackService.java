package com.examify.core.feedback;

import com.examify.common.exception.NotFoundException;
import com.examify.common.exception.ValidationException;
import com.examify.core.event.FeedbackSubmittedEvent;
import com.examify.data.entity.AiFeedback;
import com.examify.data.entity.DocumentChunk;
import com.examify.data.entity.RetrievalSession;
import com.examify.data.repository.AiFeedbackRepository;
import com.examify.data.repository.DocumentChunkRepository;
import com.examify.data.repository.RetrievalSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class FeedbackService {

    private final AiFeedbackRepository feedbackRepository;
    private final RetrievalSessionRepository sessionRepository;
    private final DocumentChunkRepository chunkRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Stores a rating for an answered question. Listeners of {@link FeedbackSubmittedEvent} run inside this
     * transaction, so review flags and the feedback row commit together.
     *
     * @param contextChunkIds chunks to attribute the rating to; null means the chunks the session used
     */
    @Transactional
    public AiFeedback submitFeedback(
        UUID userId,
        UUID sessionId,
        int rating,
        String comment,
        boolean aiLowConfidence,
        List<UUID> contextChunkIds
    ) {
        if (rating < 1 || rating > 5) {
            throw new ValidationException("Rating must be between 1 and 5");
        }
        RetrievalSession session = sessionRepository.findByIdAndUserId(sessionId, userId)
            .orElseThrow(() -> new NotFoundException("RetrievalSession", sessionId));

        Set<DocumentChunk> chunks = contextChunkIds != null
            ? resolveExplicit(contextChunkIds)
            : new LinkedHashSet<>(chunkRepository.findAllById(session.getUsedChunkIds()));

        AiFeedback feedback = feedbackRepository.saveAndFlush(AiFeedback.builder()
            .session(session)
            .userId(userId)
            .rating(rating)
            .comment(comment != null && !comment.isBlank() ? comment.trim() : null)
            .aiLowConfidence(aiLowConfidence)
            .contextChunks(chunks)
            .build());

        Set<UUID> chunkIds = chunks.stream().map(DocumentChunk::getId).collect(Collectors.toCollection(LinkedHashSet::new));
        eventPublisher.publishEvent(new FeedbackSubmittedEvent(feedback.getId(), rating, aiLowConfidence, chunkIds));

        log.info("[FEEDBACK] Recorded | feedbackId={} | sessionId={} | rating={} | lowConfidence={} | chunks={}",
            feedback.getId(), sessionId, rating, aiLowConfidence, chunkIds.size());
        return feedback;
    }

    private Set<DocumentChunk> resolveExplicit(Collection<UUID> ids) {
        Set<UUID> wanted = new LinkedHashSet<>(ids);
        List<DocumentChunk> found = chunkRepository.findAllById(wanted);
        if (found.size() != wanted.size()) {
            Set<UUID> foundIds = found.stream().map(DocumentChunk::getId).collect(Collectors.toSet());
            wanted.removeAll(foundIds);
            throw new ValidationException("Unknown context chunk ids: " + wanted);
        }
        return new LinkedHashSet<>(found);
    }
}
