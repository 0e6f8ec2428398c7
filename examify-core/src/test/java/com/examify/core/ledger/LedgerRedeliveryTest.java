package com.examify.core.ledger;

import com.examify.core.event.ExamCompletedEvent;
import com.examify.core.event.MaterialUploadedEvent;
import com.examify.data.entity.ActivityEventKind;
import com.examify.data.entity.LedgerOutboxEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LedgerRedeliveryTest {

    @Mock
    private LedgerWriter writer;

    @Mock
    private LedgerOutbox outbox;

    private ProgressLedger ledger;
    private LedgerRedeliveryWorker worker;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        LedgerProperties properties = new LedgerProperties();
        ledger = new ProgressLedger(writer, outbox, properties);
        worker = new LedgerRedeliveryWorker(outbox, ledger, properties);
    }

    @Test
    void failedCompletionIsKeptAndAppliedOnceByRedelivery() {
        UUID attemptId = UUID.randomUUID();
        doThrow(new CannotAcquireLockException("lock timeout on user_profiles"))
            .doNothing()
            .when(writer).applyExamCompleted(userId, attemptId, 80.0, 25);

        ledger.onExamCompleted(new ExamCompletedEvent(attemptId, userId, 80.0));
        verify(outbox).recordFailure(eq(ActivityEventKind.EXAM_COMPLETED), eq(attemptId), any(CannotAcquireLockException.class));

        LedgerOutboxEvent pending = LedgerOutboxEvent.builder()
            .eventKind(ActivityEventKind.EXAM_COMPLETED)
            .sourceEntityId(attemptId)
            .userId(userId)
            .score(80.0)
            .deliveryAttempts(1)
            .build();
        when(outbox.findUndelivered(any(Instant.class), eq(50))).thenReturn(List.of(pending), List.of());

        assertEquals(1, worker.redeliver(Instant.now()));
        assertEquals(0, worker.redeliver(Instant.now()));

        verify(writer, times(2)).applyExamCompleted(userId, attemptId, 80.0, 25);
        verify(outbox, times(1)).recordFailure(any(), any(), any());
    }

    @Test
    void alreadyAppliedEntryIsClosedWithoutAwardingAgain() {
        UUID materialId = UUID.randomUUID();
        doThrow(new DataIntegrityViolationException("uk_activity_logs_user_kind_source"))
            .when(writer).applyMaterialUploaded(userId, materialId, 10);

        assertFalse(ledger.recordMaterialUploaded(materialId, userId));

        verify(outbox).markDelivered(ActivityEventKind.MATERIAL_UPLOADED, materialId);
        verify(outbox, never()).recordFailure(any(), any(), any());
    }

    @Test
    void oneFailingEntryDoesNotBlockTheRest() {
        UUID brokenMaterial = UUID.randomUUID();
        UUID materialId = UUID.randomUUID();
        doThrow(new CannotAcquireLockException("still locked"))
            .when(writer).applyMaterialUploaded(userId, brokenMaterial, 10);
        doNothing().when(writer).applyMaterialUploaded(userId, materialId, 10);
        when(outbox.findUndelivered(any(Instant.class), eq(50))).thenReturn(List.of(
            upload(brokenMaterial),
            upload(materialId)));

        assertEquals(1, worker.redeliver(Instant.now()));

        verify(outbox).recordFailure(eq(ActivityEventKind.MATERIAL_UPLOADED), eq(brokenMaterial), any());
        verify(writer).applyMaterialUploaded(userId, materialId, 10);
    }

    @Test
    void successfulListenerDeliveryRecordsNoFailure() {
        UUID materialId = UUID.randomUUID();

        ledger.onMaterialUploaded(new MaterialUploadedEvent(materialId, userId));

        verify(writer).applyMaterialUploaded(userId, materialId, 10);
        verifyNoInteractions(outbox);
    }

    private LedgerOutboxEvent upload(UUID materialId) {
        return LedgerOutboxEvent.builder()
            .eventKind(ActivityEventKind.MATERIAL_UPLOADED)
            .sourceEntityId(materialId)
            .userId(userId)
            .build();
    }
}
