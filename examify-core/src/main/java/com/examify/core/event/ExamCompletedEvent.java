package com.examify.core.event;

import lombok.Value;

import java.util.UUID;

/**
 * Published exactly once per attempt, by the transaction that moves it to COMPLETED.
 *
 * <ul>
 *   <li>{@code attemptId}: the completed attempt, also the ledger's source entity id</li>
 *   <li>{@code userId}: the attempt's owner</li>
 *   <li>{@code score}: total points awarded</li>
 * </ul>
 */
@Value
public class ExamCompletedEvent {
    UUID attemptId;
    UUID userId;
    double score;
}
