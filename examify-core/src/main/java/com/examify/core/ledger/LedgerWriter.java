package com.examify.core.ledger;

import com.examify.data.entity.ActivityEventKind;
import com.examify.data.entity.ActivityLog;
import com.examify.data.entity.UserProfile;
import com.examify.data.repository.ActivityLogRepository;
import com.examify.data.repository.LedgerOutboxRepository;
import com.examify.data.repository.MockExamAttemptRepository;
import com.examify.data.repository.MockExamAttemptRepository.CompletedAttemptStats;
import com.examify.data.repository.UserProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Transactions behind {@link ProgressLedger}. A duplicate activity row surfaces as
 * {@link org.springframework.dao.DataIntegrityViolationException} and rolls back everything in the entry.
 * A successful entry closes its outbox row in the same transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerWriter {

    private final UserProfileRepository profileRepository;
    private final ActivityLogRepository activityLogRepository;
    private final MockExamAttemptRepository attemptRepository;
    private final LedgerOutboxRepository outboxRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean createProfileIfMissing(UUID userId) {
        if (profileRepository.existsById(userId)) {
            return false;
        }
        return profileRepository.insertEmpty(userId) > 0;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void applyExamCompleted(UUID userId, UUID attemptId, double score, int points) {
        insertActivity(userId, ActivityEventKind.EXAM_COMPLETED, attemptId, points, "score=" + score);

        // lock the profile so two completions cannot interleave their recomputes
        profileRepository.findByIdForUpdate(userId)
            .orElseThrow(() -> new IllegalStateException("Profile missing for user " + userId));

        CompletedAttemptStats stats = attemptRepository.computeCompletedStats(userId);
        int completed = stats.getCompletedCount() != null ? stats.getCompletedCount().intValue() : 0;
        Double average = stats.getAverageScore() != null ? round2(stats.getAverageScore()) : null;

        Instant now = Instant.now();
        profileRepository.updateExamStatistics(userId, completed, average, now);
        profileRepository.addPoints(userId, points, now);
        outboxRepository.markDelivered(ActivityEventKind.EXAM_COMPLETED, attemptId, now);
        log.info("[LEDGER] Exam completion applied | userId={} | attemptId={} | completed={} | average={} | points={}",
            userId, attemptId, completed, average, points);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void applyMaterialUploaded(UUID userId, UUID materialId, int points) {
        insertActivity(userId, ActivityEventKind.MATERIAL_UPLOADED, materialId, points, null);
        Instant now = Instant.now();
        profileRepository.incrementMaterialsUploaded(userId, now);
        profileRepository.addPoints(userId, points, now);
        outboxRepository.markDelivered(ActivityEventKind.MATERIAL_UPLOADED, materialId, now);
        log.info("[LEDGER] Material upload applied | userId={} | materialId={} | points={}", userId, materialId, points);
    }

    @Transactional(readOnly = true)
    public UserProfile findProfile(UUID userId) {
        return profileRepository.findById(userId).orElse(null);
    }

    private void insertActivity(UUID userId, ActivityEventKind kind, UUID sourceId, int points, String details) {
        activityLogRepository.saveAndFlush(ActivityLog.builder()
            .userId(userId)
            .eventKind(kind)
            .sourceEntityId(sourceId.toString())
            .pointsAwarded(points)
            .details(details)
            .build());
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
