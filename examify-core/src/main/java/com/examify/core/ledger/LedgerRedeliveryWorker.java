package com.examify.core.ledger;

import com.examify.data.entity.ActivityEventKind;
import com.examify.data.entity.LedgerOutboxEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Re-applies outbox entries whose after-commit delivery never succeeded. Entries younger than
 * {@code redelivery-delay-seconds} are left to the listener that is normally still handling them.
 */
@Component
@ConditionalOnProperty(prefix = "examify.ledger", name = "redelivery-enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerRedeliveryWorker {

    private final LedgerOutbox outbox;
    private final ProgressLedger progressLedger;
    private final LedgerProperties properties;

    @Scheduled(
        fixedDelayString = "${examify.ledger.redelivery-interval-ms:30000}",
        initialDelayString = "${examify.ledger.redelivery-interval-ms:30000}"
    )
    public void redeliverStale() {
        try {
            redeliver(Instant.now().minusSeconds(properties.getRedeliveryDelaySeconds()));
        } catch (Exception e) {
            log.error("[LEDGER] Redelivery cycle failed", e);
        }
    }

    /**
     * @return number of entries that reached the ledger in this pass, replays included
     */
    public int redeliver(Instant createdBefore) {
        List<LedgerOutboxEvent> pending = outbox.findUndelivered(createdBefore, properties.getRedeliveryBatchSize());
        if (pending.isEmpty()) {
            return 0;
        }
        log.info("[LEDGER] Redelivering outbox entries | count={}", pending.size());

        int delivered = 0;
        for (LedgerOutboxEvent entry : pending) {
            try {
                if (entry.getEventKind() == ActivityEventKind.EXAM_COMPLETED) {
                    progressLedger.recordExamCompleted(entry.getSourceEntityId(), entry.getUserId(),
                        entry.getScore() != null ? entry.getScore() : 0.0);
                } else {
                    progressLedger.recordMaterialUploaded(entry.getSourceEntityId(), entry.getUserId());
                }
                delivered++;
            } catch (RuntimeException e) {
                log.warn("[LEDGER] Redelivery failed | kind={} | sourceId={} | attempts={} | error={}",
                    entry.getEventKind(), entry.getSourceEntityId(), entry.getDeliveryAttempts() + 1, e.getMessage());
                outbox.recordFailure(entry.getEventKind(), entry.getSourceEntityId(), e);
            }
        }
        return delivered;
    }
}
