package com.examify.core.event;

import lombok.Value;

import java.util.Set;
import java.util.UUID;

/**
 * Published inside the transaction that stores an AI feedback row.
 *
 * <ul>
 *   <li>{@code feedbackId}: the stored feedback</li>
 *   <li>{@code rating}: 1 to 5</li>
 *   <li>{@code aiLowConfidence}: whether the user marked the answer as unreliable</li>
 *   <li>{@code contextChunkIds}: chunks the rated answer was built from</li>
 * </ul>
 */
@Value
public class FeedbackSubmittedEvent {
    UUID feedbackId;
    int rating;
    boolean aiLowConfidence;
    Set<UUID> contextChunkIds;
}
