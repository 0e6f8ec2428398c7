package com.examify.core.feedback;

import com.examify.core.event.FeedbackSubmittedEvent;
import com.examify.data.repository.DocumentChunkRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewFlaggerTest {

    @Mock
    private DocumentChunkRepository chunkRepository;

    @InjectMocks
    private ReviewFlagger flagger;

    private final Set<UUID> chunks = Set.of(UUID.randomUUID(), UUID.randomUUID());

    @Test
    void lowRatingFlagsEveryChunkOnce() {
        flagger.onFeedbackSubmitted(new FeedbackSubmittedEvent(UUID.randomUUID(), 1, false, chunks));

        verify(chunkRepository, times(1)).incrementReviewFlags(chunks);
    }

    @Test
    void ratingOfTwoStillFlags() {
        flagger.onFeedbackSubmitted(new FeedbackSubmittedEvent(UUID.randomUUID(), 2, false, chunks));

        verify(chunkRepository).incrementReviewFlags(chunks);
    }

    @Test
    void lowConfidenceFlagsDespiteGoodRating() {
        flagger.onFeedbackSubmitted(new FeedbackSubmittedEvent(UUID.randomUUID(), 5, true, chunks));

        verify(chunkRepository).incrementReviewFlags(chunks);
    }

    @Test
    void goodRatingLeavesChunksAlone() {
        flagger.onFeedbackSubmitted(new FeedbackSubmittedEvent(UUID.randomUUID(), 3, false, chunks));
        flagger.onFeedbackSubmitted(new FeedbackSubmittedEvent(UUID.randomUUID(), 5, false, chunks));

        verify(chunkRepository, never()).incrementReviewFlags(anyCollection());
    }

    @Test
    void noChunksMeansNoUpdate() {
        flagger.onFeedbackSubmitted(new FeedbackSubmittedEvent(UUID.randomUUID(), 1, false, Set.of()));

        verifyNoInteractions(chunkRepository);
    }
}
