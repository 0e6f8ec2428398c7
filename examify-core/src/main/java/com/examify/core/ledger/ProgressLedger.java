package com.examify.core.ledger;

import com.examify.core.event.ExamCompletedEvent;
import com.examify.core.event.MaterialUploadedEvent;
import com.examify.data.entity.ActivityEventKind;
import com.examify.data.entity.UserProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.UUID;

/**
 * Applies progress events to a user's profile, at most once per (user, event kind, source entity).
 *
 * <p>Listeners run after the publishing transaction committed. An event they fail to apply stays open in
 * the {@link LedgerOutbox} and {@link LedgerRedeliveryWorker} applies it later. Replays of an already
 * applied event are detected by the unique key on the activity log and skipped without touching the profile.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressLedger {

    private final LedgerWriter writer;
    private final LedgerOutbox outbox;
    private final LedgerProperties properties;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onExamCompleted(ExamCompletedEvent event) {
        try {
            recordExamCompleted(event.getAttemptId(), event.getUserId(), event.getScore());
        } catch (RuntimeException e) {
            log.warn("[LEDGER] Exam completion left for redelivery | attemptId={} | userId={} | error={}",
                event.getAttemptId(), event.getUserId(), e.getMessage());
            noteFailure(ActivityEventKind.EXAM_COMPLETED, event.getAttemptId(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onMaterialUploaded(MaterialUploadedEvent event) {
        try {
            recordMaterialUploaded(event.getMaterialId(), event.getUserId());
        } catch (RuntimeException e) {
            log.warn("[LEDGER] Material upload left for redelivery | materialId={} | userId={} | error={}",
                event.getMaterialId(), event.getUserId(), e.getMessage());
            noteFailure(ActivityEventKind.MATERIAL_UPLOADED, event.getMaterialId(), e);
        }
    }

    /**
     * @return false when this attempt was already recorded
     */
    public boolean recordExamCompleted(UUID attemptId, UUID userId, double score) {
        ensureProfile(userId);
        try {
            writer.applyExamCompleted(userId, attemptId, score, properties.getExamCompletedPoints());
            return true;
        } catch (DataIntegrityViolationException duplicate) {
            log.debug("[LEDGER] Duplicate exam completion ignored | attemptId={} | userId={}", attemptId, userId);
            outbox.markDelivered(ActivityEventKind.EXAM_COMPLETED, attemptId);
            return false;
        }
    }

    /**
     * @return false when this material was already recorded
     */
    public boolean recordMaterialUploaded(UUID materialId, UUID userId) {
        ensureProfile(userId);
        try {
            writer.applyMaterialUploaded(userId, materialId, properties.getMaterialUploadedPoints());
            return true;
        } catch (DataIntegrityViolationException duplicate) {
            log.debug("[LEDGER] Duplicate material upload ignored | materialId={} | userId={}", materialId, userId);
            outbox.markDelivered(ActivityEventKind.MATERIAL_UPLOADED, materialId);
            return false;
        }
    }

    /**
     * Current aggregates; a user with no recorded activity gets an all-zero profile that is not stored.
     */
    public UserProfile getProfile(UUID userId) {
        UserProfile profile = writer.findProfile(userId);
        if (profile != null) {
            return profile;
        }
        return UserProfile.builder()
            .userId(userId)
            .mockExamsCompleted(0)
            .studyMaterialsUploadedCount(0)
            .totalPoints(0L)
            .build();
    }

    private void noteFailure(ActivityEventKind kind, UUID sourceId, RuntimeException error) {
        try {
            outbox.recordFailure(kind, sourceId, error);
        } catch (RuntimeException recordError) {
            log.error("[LEDGER] Could not record delivery failure | kind={} | sourceId={}", kind, sourceId, recordError);
        }
    }

    private void ensureProfile(UUID userId) {
        try {
            if (writer.createProfileIfMissing(userId)) {
                log.info("[LEDGER] Profile created | userId={}", userId);
            }
        } catch (DataIntegrityViolationException concurrentCreate) {
            log.debug("[LEDGER] Profile created concurrently | userId={}", userId);
        }
    }
}
