package com.examify.core.feedback;

import com.examify.core.event.FeedbackSubmittedEvent;
import com.examify.data.repository.DocumentChunkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Marks chunks behind a poorly rated or low-confidence answer for review. Runs synchronously in the
 * transaction that stored the feedback.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReviewFlagger {

    static final int LOW_RATING_THRESHOLD = 2;

    private final DocumentChunkRepository chunkRepository;

    @EventListener
    public void onFeedbackSubmitted(FeedbackSubmittedEvent event) {
        boolean warrantsReview = event.getRating() <= LOW_RATING_THRESHOLD || event.isAiLowConfidence();
        if (!warrantsReview || event.getContextChunkIds().isEmpty()) {
            return;
        }
        int flagged = chunkRepository.incrementReviewFlags(event.getContextChunkIds());
        log.info("[FEEDBACK] Chunks flagged for review | feedbackId={} | rating={} | lowConfidence={} | flagged={}",
            event.getFeedbackId(), event.getRating(), event.isAiLowConfidence(), flagged);
    }
}
