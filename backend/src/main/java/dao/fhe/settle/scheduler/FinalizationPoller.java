package dao.fhe.settle.scheduler;

import dao.fhe.settle.config.SchedulerProperties;
import dao.fhe.settle.event.BatchFinalizedEvent;
import dao.fhe.settle.exception.DecryptionUnavailableException;
import dao.fhe.settle.exception.NetworkTransientException;
import dao.fhe.settle.ledger.IntentStore;
import dao.fhe.settle.service.BatchProcessingReport;
import dao.fhe.settle.service.BatchSettlementService;
import dao.fhe.settle.service.OperatorIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scans the ledger for BatchFinalized events and hands every batch this operator is
 * selected for to {@link BatchSettlementService}. The cursor only advances after a
 * successful scan, so a failed tick re-reads the same range next time.
 */
@Slf4j
@Component
public class FinalizationPoller {

    private final IntentStore intentStore;
    private final BatchSettlementService settlementService;
    private final OperatorIdentity operator;
    private final SchedulerProperties schedulerProps;
    private final FinalizationCursor cursor = new FinalizationCursor();

    public FinalizationPoller(IntentStore intentStore,
                              BatchSettlementService settlementService,
                              OperatorIdentity operator,
                              SchedulerProperties schedulerProps) {
        this.intentStore = intentStore;
        this.settlementService = settlementService;
        this.operator = operator;
        this.schedulerProps = schedulerProps;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void backfillOnStartup() {
        if (!schedulerProps.getFinalization().isEnabled()) {
            return;
        }
        try {
            long head = intentStore.currentBlock();
            cursor.initialize(head - schedulerProps.getFinalization().getBackfillBlocks());
            log.info("Finalization poller starting at block {} (head {}), operator {}",
                    cursor.getLastProcessedBlock(), head, operator.address());
        } catch (NetworkTransientException e) {
            log.warn("Ledger unreachable on startup, backfill postponed to the first tick: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${scheduler.finalization.check-interval-ms:5000}")
    public void poll() {
        if (!schedulerProps.getFinalization().isEnabled()) {
            return;
        }
        tick();
    }

    /** One poll iteration. */
    public void tick() {
        long head;
        try {
            head = intentStore.currentBlock();
        } catch (NetworkTransientException e) {
            log.warn("Cannot read head block: {}", e.getMessage());
            return;
        }
        if (!cursor.isInitialized()) {
            cursor.initialize(head - schedulerProps.getFinalization().getBackfillBlocks());
        }

        for (String batchId : cursor.deferred()) {
            log.info("Retrying deferred batch {}", batchId);
            handle(batchId);
        }

        long from = cursor.getLastProcessedBlock() + 1;
        if (head >= from) {
            List<BatchFinalizedEvent> events;
            try {
                events = intentStore.findBatchFinalized(from, head);
            } catch (NetworkTransientException e) {
                log.warn("BatchFinalized scan {}..{} failed, will retry: {}", from, head, e.getMessage());
                return;
            }
            log.debug("Scanned blocks {}..{}: {} BatchFinalized events", from, head, events.size());
            for (BatchFinalizedEvent event : events) {
                if (!cursor.isProcessed(event.batchId())) {
                    handle(event.batchId());
                }
            }
            cursor.advanceTo(head);
        }

        settlementService.retryPending();
    }

    public FinalizationCursor cursor() {
        return cursor;
    }

    private void handle(String batchId) {
        try {
            if (!intentStore.isCommitteeMemberSelected(batchId, operator.address())) {
                log.info("Operator not selected for batch {}, skipping", batchId);
                cursor.markProcessed(batchId);
                return;
            }
            BatchProcessingReport report = settlementService.processFinalizedBatch(batchId);
            log.info("Batch {} processed: {}", batchId, report.outcome());
            cursor.markProcessed(batchId);
        } catch (DecryptionUnavailableException | NetworkTransientException e) {
            log.warn("Batch {} deferred: {}", batchId, e.getMessage());
            cursor.defer(batchId);
        } catch (RuntimeException e) {
            log.error("Batch {} processing failed, deferred: {}", batchId, e.getMessage(), e);
            cursor.defer(batchId);
        }
    }
}
