package dao.fhe.settle.controller;

import dao.fhe.settle.config.BatchProperties;
import dao.fhe.settle.config.SchedulerProperties;
import dao.fhe.settle.ledger.IntentStore;
import dao.fhe.settle.model.Batch;
import dao.fhe.settle.scheduler.FinalizationPoller;
import dao.fhe.settle.service.BatchAccumulator;
import dao.fhe.settle.service.BatchProcessingReport;
import dao.fhe.settle.service.BatchSettlementService;
import dao.fhe.settle.service.OperatorIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Monitoring endpoints for batches and settlement progress.
 * Open batches are only visible with the local ledger.
 */
@Slf4j
@RestController
@RequestMapping("/api/monitor")
public class BatchMonitoringController {

    private final IntentStore intentStore;
    private final BatchSettlementService settlementService;
    private final Optional<BatchAccumulator> accumulator;
    private final FinalizationPoller poller;
    private final OperatorIdentity operator;
    private final SchedulerProperties schedulerProps;
    private final BatchProperties batchProps;

    public BatchMonitoringController(IntentStore intentStore,
                                     BatchSettlementService settlementService,
                                     Optional<BatchAccumulator> accumulator,
                                     FinalizationPoller poller,
                                     OperatorIdentity operator,
                                     SchedulerProperties schedulerProps,
                                     BatchProperties batchProps) {
        this.intentStore = intentStore;
        this.settlementService = settlementService;
        this.accumulator = accumulator;
        this.poller = poller;
        this.operator = operator;
        this.schedulerProps = schedulerProps;
        this.batchProps = batchProps;
    }

    /**
     * GET /api/monitor/batches
     * Open batches (local ledger) and every batch this engine has processed.
     */
    @GetMapping("/batches")
    public ResponseEntity<Map<String, Object>> getAllBatches() {
        Map<String, Object> response = new LinkedHashMap<>();
        List<Map<String, Object>> open = new ArrayList<>();
        accumulator.ifPresent(acc -> acc.openBatches().forEach(b -> open.add(buildBatchInfo(b))));
        List<BatchProcessingReport> processed = settlementService.reports();

        response.put("status", "SUCCESS");
        response.put("openBatches", open);
        response.put("processedBatches", processed);
        response.put("statistics", Map.of(
                "open", open.size(),
                "processed", processed.size(),
                "published", processed.stream().filter(r -> r.outcome() == BatchProcessingReport.Outcome.PUBLISHED).count()
        ));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/batches/{batchId}
     */
    @GetMapping("/batches/{batchId}")
    public ResponseEntity<Map<String, Object>> getBatchDetails(@PathVariable String batchId) {
        Map<String, Object> response = new LinkedHashMap<>();
        Optional<Batch> batch = intentStore.getBatch(batchId);
        if (batch.isEmpty()) {
            response.put("status", "NOT_FOUND");
            response.put("error", "Batch not found: " + batchId);
            return ResponseEntity.status(404).body(response);
        }
        response.put("status", "SUCCESS");
        response.put("batch", buildBatchInfo(batch.get()));
        settlementService.report(batchId).ifPresent(r -> response.put("processing", r));
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/monitor/batches/{batchId}/finalize-now
     * Administrative finalization as the operator (local ledger only).
     */
    @PostMapping("/batches/{batchId}/finalize-now")
    public ResponseEntity<Map<String, Object>> finalizeNow(@PathVariable String batchId) {
        Map<String, Object> response = new LinkedHashMap<>();
        if (accumulator.isEmpty()) {
            response.put("success", false);
            response.put("error", "Finalization is driven by the ledger contract in rpc mode");
            return ResponseEntity.badRequest().body(response);
        }
        boolean finalized = accumulator.get().adminFinalize(batchId, operator.address());
        response.put("success", finalized);
        response.put("batchId", batchId);
        if (!finalized) {
            response.put("error", "Batch is empty");
        }
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("operator", operator.address());
        response.put("schedulers", Map.of(
                "finalization", Map.of(
                        "enabled", schedulerProps.getFinalization().isEnabled(),
                        "lastProcessedBlock", poller.cursor().getLastProcessedBlock(),
                        "processedBatches", poller.cursor().processedCount(),
                        "deferredBatches", poller.cursor().deferred()
                ),
                "idle", Map.of(
                        "enabled", schedulerProps.getIdle().isEnabled() && accumulator.isPresent(),
                        "maxIdleSeconds", batchProps.getMaxIdleSeconds()
                )
        ));
        response.put("batching", Map.of(
                "blockInterval", batchProps.getBlockInterval(),
                "maxIntents", batchProps.getMaxIntents()
        ));
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> buildBatchInfo(Batch batch) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("batchId", batch.getId());
        info.put("poolId", batch.getPoolId());
        info.put("state", batch.getState());
        info.put("createdBlock", batch.getCreatedBlock());
        info.put("intentCount", batch.getIntentIds().size());
        info.put("intentIds", batch.getIntentIds());
        info.put("finalizedBlock", batch.getFinalizedBlock());
        info.put("finalizationTrigger", batch.getFinalizationTrigger());
        return info;
    }
}
