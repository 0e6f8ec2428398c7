package com.examify.core.ledger;

import com.examify.core.event.ExamCompletedEvent;
import com.examify.core.event.MaterialUploadedEvent;
import com.examify.data.entity.ActivityEventKind;
import com.examify.data.entity.LedgerOutboxEvent;
import com.examify.data.repository.LedgerOutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Durable copy of every progress event. The row is written before the publishing transaction commits,
 * so an attempt cannot be COMPLETED (or a material stored) without a matching pending ledger entry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerOutbox {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final LedgerOutboxRepository outboxRepository;

    @TransactionalEventListener(phase = TransactionPhase.BEFORE_COMMIT)
    public void onExamCompleted(ExamCompletedEvent event) {
        outboxRepository.saveAndFlush(LedgerOutboxEvent.builder()
            .eventKind(ActivityEventKind.EXAM_COMPLETED)
            .sourceEntityId(event.getAttemptId())
            .userId(event.getUserId())
            .score(event.getScore())
            .build());
        log.debug("[LEDGER] Outbox entry written | kind=EXAM_COMPLETED | attemptId={}", event.getAttemptId());
    }

    @TransactionalEventListener(phase = TransactionPhase.BEFORE_COMMIT)
    public void onMaterialUploaded(MaterialUploadedEvent event) {
        outboxRepository.saveAndFlush(LedgerOutboxEvent.builder()
            .eventKind(ActivityEventKind.MATERIAL_UPLOADED)
            .sourceEntityId(event.getMaterialId())
            .userId(event.getUserId())
            .build());
        log.debug("[LEDGER] Outbox entry written | kind=MATERIAL_UPLOADED | materialId={}", event.getMaterialId());
    }

    @Transactional(readOnly = true)
    public List<LedgerOutboxEvent> findUndelivered(Instant createdBefore, int limit) {
        return outboxRepository.findUndelivered(createdBefore, PageRequest.of(0, limit));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markDelivered(ActivityEventKind kind, UUID sourceId) {
        outboxRepository.markDelivered(kind, sourceId, Instant.now());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordFailure(ActivityEventKind kind, UUID sourceId, Exception error) {
        String message = String.valueOf(error.getMessage());
        if (message.length() > MAX_ERROR_LENGTH) {
            message = message.substring(0, MAX_ERROR_LENGTH);
        }
        outboxRepository.recordFailure(kind, sourceId, message);
    }
}
