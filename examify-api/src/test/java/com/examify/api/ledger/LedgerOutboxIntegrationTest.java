package com.examify.api.ledger;

import com.examify.core.ledger.LedgerRedeliveryWorker;
import com.examify.core.ledger.ProgressLedger;
import com.examify.core.material.StudyMaterialService;
import com.examify.data.entity.ActivityEventKind;
import com.examify.data.entity.AttemptStatus;
import com.examify.data.entity.LedgerOutboxEvent;
import com.examify.data.entity.MockExam;
import com.examify.data.entity.MockExamAttempt;
import com.examify.data.entity.StudyMaterial;
import com.examify.data.entity.UserProfile;
import com.examify.data.repository.ActivityLogRepository;
import com.examify.data.repository.LedgerOutboxRepository;
import com.examify.data.repository.MockExamAttemptRepository;
import com.examify.data.repository.MockExamRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class LedgerOutboxIntegrationTest {

    @Autowired
    private ProgressLedger progressLedger;

    @Autowired
    private LedgerRedeliveryWorker redeliveryWorker;

    @Autowired
    private StudyMaterialService materialService;

    @Autowired
    private LedgerOutboxRepository outboxRepository;

    @Autowired
    private ActivityLogRepository activityLogRepository;

    @Autowired
    private MockExamRepository examRepository;

    @Autowired
    private MockExamAttemptRepository attemptRepository;

    private UUID userId;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
    }

    @Test
    void uploadWritesAnOutboxEntryThatIsDeliveredAfterCommit() {
        StudyMaterial material = materialService.upload(userId,
            new MockMultipartFile("file", "enzymes.txt", "text/plain",
                "Enzymes lower the activation energy of reactions.".getBytes(StandardCharsets.UTF_8)),
            "Enzyme notes", null);

        LedgerOutboxEvent entry = outboxRepository
            .findByEventKindAndSourceEntityId(ActivityEventKind.MATERIAL_UPLOADED, material.getId())
            .orElseThrow();
        assertEquals(userId, entry.getUserId());
        assertTrue(entry.isDelivered());
        assertEquals(10L, progressLedger.getProfile(userId).getTotalPoints());
    }

    @Test
    void undeliveredCompletionIsAppliedExactlyOnceByRedelivery() {
        MockExamAttempt attempt = completedAttempt(64.0);
        outboxRepository.saveAndFlush(LedgerOutboxEvent.builder()
            .eventKind(ActivityEventKind.EXAM_COMPLETED)
            .sourceEntityId(attempt.getId())
            .userId(userId)
            .score(64.0)
            .deliveryAttempts(1)
            .lastError("lock timeout")
            .build());
        assertEquals(0L, progressLedger.getProfile(userId).getTotalPoints());

        redeliveryWorker.redeliver(Instant.now().plusSeconds(1));
        redeliveryWorker.redeliver(Instant.now().plusSeconds(1));

        UserProfile profile = progressLedger.getProfile(userId);
        assertEquals(1, profile.getMockExamsCompleted());
        assertEquals(64.0, profile.getAverageMockExamScore(), 1e-9);
        assertEquals(25L, profile.getTotalPoints());
        assertEquals(1, activityLogRepository.countByUserIdAndEventKind(userId, ActivityEventKind.EXAM_COMPLETED));
        assertTrue(outboxRepository
            .findByEventKindAndSourceEntityId(ActivityEventKind.EXAM_COMPLETED, attempt.getId())
            .orElseThrow()
            .isDelivered());
    }

    @Test
    void openEntryForAnAppliedEventIsClosedWithoutNewPoints() {
        MockExamAttempt attempt = completedAttempt(90.0);
        assertTrue(progressLedger.recordExamCompleted(attempt.getId(), userId, 90.0));
        outboxRepository.saveAndFlush(LedgerOutboxEvent.builder()
            .eventKind(ActivityEventKind.EXAM_COMPLETED)
            .sourceEntityId(attempt.getId())
            .userId(userId)
            .score(90.0)
            .build());

        redeliveryWorker.redeliver(Instant.now().plusSeconds(1));

        assertEquals(25L, progressLedger.getProfile(userId).getTotalPoints());
        assertTrue(outboxRepository
            .findByEventKindAndSourceEntityId(ActivityEventKind.EXAM_COMPLETED, attempt.getId())
            .orElseThrow()
            .isDelivered());
    }

    private MockExamAttempt completedAttempt(double score) {
        MockExam exam = examRepository.save(MockExam.builder().title("Genetics Quiz").build());
        return attemptRepository.save(MockExamAttempt.builder()
            .userId(userId)
            .mockExam(exam)
            .status(AttemptStatus.COMPLETED)
            .score(score)
            .completedAt(Instant.now())
            .build());
    }
}
