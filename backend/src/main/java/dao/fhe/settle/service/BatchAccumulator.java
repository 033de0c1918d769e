package dao.fhe.settle.service;

import dao.fhe.settle.config.BatchProperties;
import dao.fhe.settle.event.BatchFinalizedEvent;
import dao.fhe.settle.exception.UnauthorizedFinalizerException;
import dao.fhe.settle.ledger.BlockClock;
import dao.fhe.settle.model.Batch;
import dao.fhe.settle.model.BatchState;
import dao.fhe.settle.model.FinalizationTrigger;
import dao.fhe.settle.model.Intent;
import dao.fhe.settle.repository.BatchRepository;
import dao.fhe.settle.repository.IntentRepository;
import dao.fhe.settle.util.EthSignatures;
import dao.fhe.settle.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Groups intents into per-pool batches and drives their finalization. Every mutation is
 * serialized on this instance, so finalizers racing on one batch see a single transition.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "local", matchIfMissing = true)
public class BatchAccumulator {

    private final BatchRepository batchRepository;
    private final IntentRepository intentRepository;
    private final BatchProperties props;
    private final BlockClock blockClock;
    private final List<String> privilegedFinalizers;

    // block order; events older than batch.event-retention-blocks are pruned
    private final Deque<BatchFinalizedEvent> finalizedEvents = new ArrayDeque<>();
    private final AtomicLong batchSeq = new AtomicLong(1);

    public BatchAccumulator(BatchRepository batchRepository,
                            IntentRepository intentRepository,
                            BatchProperties props,
                            BlockClock blockClock,
                            OperatorIdentity operator) {
        this.batchRepository = batchRepository;
        this.intentRepository = intentRepository;
        this.props = props;
        this.blockClock = blockClock;
        this.privilegedFinalizers = new ArrayList<>(props.getPrivilegedFinalizers());
        this.privilegedFinalizers.add(operator.address());
    }

    /**
     * Adds the intent to its pool's open batch, opening one when needed.
     *
     * @return id of the batch the intent landed in
     */
    public synchronized String submit(Intent intent) {
        long now = blockClock.nowSeconds();
        long block = blockClock.currentBlock();
        if (intent.isExpiredAt(now)) {
            throw new IllegalArgumentException("Intent " + intent.getId() + " expired at " + intent.getDeadline());
        }
        intentRepository.save(intent);

        Batch batch = batchRepository.findOpenByPool(intent.getPoolId()).orElse(null);
        if (batch != null && blockIntervalElapsed(batch, block)) {
            finalizeBatch(batch, FinalizationTrigger.BLOCK_INTERVAL);
            batch = null;
        }
        if (batch == null) {
            batch = openBatch(intent.getPoolId(), block, now);
        }

        batch.getIntentIds().add(intent.getId());
        batch.setLastIntentAt(now);
        batchRepository.save(batch);
        log.debug("Intent {} added to batch {} ({} intents)", intent.getId(), batch.getId(), batch.getIntentIds().size());

        if (batch.getIntentIds().size() >= props.getMaxIntents()) {
            finalizeBatch(batch, FinalizationTrigger.MAX_INTENTS);
        }
        return batch.getId();
    }

    /**
     * Block-interval trigger.
     *
     * @return true when the batch is finalized after this call, including when it already was
     */
    public synchronized boolean tryFinalize(String batchId) {
        Batch batch = require(batchId);
        if (batch.getState() != BatchState.OPEN) {
            return true;
        }
        if (!blockIntervalElapsed(batch, blockClock.currentBlock())) {
            return false;
        }
        return finalizeBatch(batch, FinalizationTrigger.BLOCK_INTERVAL);
    }

    /** Idle trigger: privileged callers only, and only once the batch has been idle long enough. */
    public synchronized boolean forceFinalize(String batchId, String caller) {
        requirePrivileged(caller);
        Batch batch = require(batchId);
        if (batch.getState() != BatchState.OPEN) {
            return true;
        }
        long idleFor = blockClock.nowSeconds() - batch.getLastIntentAt();
        if (idleFor < props.getMaxIdleSeconds()) {
            return false;
        }
        return finalizeBatch(batch, FinalizationTrigger.IDLE_TIMEOUT);
    }

    /** Administrative override, no idle requirement. */
    public synchronized boolean adminFinalize(String batchId, String caller) {
        requirePrivileged(caller);
        Batch batch = require(batchId);
        if (batch.getState() != BatchState.OPEN) {
            return true;
        }
        return finalizeBatch(batch, FinalizationTrigger.ADMIN_OVERRIDE);
    }

    public Optional<Batch> getOpenBatch(String poolId) {
        return batchRepository.findOpenByPool(poolId);
    }

    public List<Batch> openBatches() {
        return batchRepository.findByState(BatchState.OPEN);
    }

    /**
     * FINALIZED to SETTLED.
     *
     * @return false when the batch was already settled
     * @throws IllegalStateException when the batch is still open
     */
    public synchronized boolean markSettled(String batchId) {
        Batch batch = require(batchId);
        if (batch.getState() == BatchState.SETTLED) {
            return false;
        }
        if (!batch.getState().canAdvanceTo(BatchState.SETTLED)) {
            throw new IllegalStateException("Batch " + batchId + " is " + batch.getState() + ", cannot settle");
        }
        batch.setState(BatchState.SETTLED);
        batchRepository.save(batch);
        log.info("Batch {} settled", batchId);
        return true;
    }

    public synchronized List<BatchFinalizedEvent> finalizedBetween(long fromBlock, long toBlock) {
        return finalizedEvents.stream()
                .filter(e -> e.blockNumber() >= fromBlock && e.blockNumber() <= toBlock)
                .toList();
    }

    private Batch openBatch(String poolId, long block, long now) {
        Batch batch = new Batch();
        batch.setId(HexUtil.keccakOf("batch", poolId, block, batchSeq.getAndIncrement()));
        batch.setPoolId(poolId);
        batch.setCreatedBlock(block);
        batch.setCreatedAt(now);
        batch.setLastIntentAt(now);
        batch.setState(BatchState.OPEN);
        batchRepository.save(batch);
        log.info("Batch {} opened for pool {} at block {}", batch.getId(), poolId, block);
        return batch;
    }

    private boolean finalizeBatch(Batch batch, FinalizationTrigger trigger) {
        if (batch.isEmpty()) {
            return false;
        }
        long block = blockClock.currentBlock();
        batch.setState(BatchState.FINALIZED);
        batch.setFinalizedBlock(block);
        batch.setFinalizedAt(blockClock.nowSeconds());
        batch.setFinalizationTrigger(trigger);
        batchRepository.save(batch);
        finalizedEvents.addLast(new BatchFinalizedEvent(batch.getId(), batch.getIntentIds().size(), block));
        pruneEvents(block);
        log.info("Batch {} finalized at block {} by {} ({} intents)",
                batch.getId(), block, trigger, batch.getIntentIds().size());
        return true;
    }

    private void pruneEvents(long currentBlock) {
        long oldestKept = currentBlock - props.getEventRetentionBlocks();
        while (!finalizedEvents.isEmpty() && finalizedEvents.peekFirst().blockNumber() < oldestKept) {
            finalizedEvents.pollFirst();
        }
    }

    private boolean blockIntervalElapsed(Batch batch, long block) {
        return block - batch.getCreatedBlock() >= props.getBlockInterval();
    }

    private void requirePrivileged(String caller) {
        boolean allowed = privilegedFinalizers.stream().anyMatch(p -> EthSignatures.sameAddress(p, caller));
        if (!allowed) {
            throw new UnauthorizedFinalizerException(caller);
        }
    }

    private Batch require(String batchId) {
        return batchRepository.findById(batchId)
                .orElseThrow(() -> new IllegalArgumentException("Batch not found: " + batchId));
    }
}
