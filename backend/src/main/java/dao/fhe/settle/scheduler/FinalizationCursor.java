package dao.fhe.settle.scheduler;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Poller state: highest block already scanned, batches already handled, batches waiting
 * for a retry. Mutated only from the scheduler thread.
 */
public class FinalizationCursor {

    private long lastProcessedBlock = -1;
    private final Set<String> processedBatchIds = new LinkedHashSet<>();
    private final Set<String> deferredBatchIds = new LinkedHashSet<>();

    public boolean isInitialized() {
        return lastProcessedBlock >= 0;
    }

    public void initialize(long block) {
        if (!isInitialized()) {
            lastProcessedBlock = Math.max(0, block);
        }
    }

    public long getLastProcessedBlock() {
        return lastProcessedBlock;
    }

    /** Moves forward only. */
    public void advanceTo(long block) {
        if (block > lastProcessedBlock) {
            lastProcessedBlock = block;
        }
    }

    public boolean isProcessed(String batchId) {
        return processedBatchIds.contains(batchId);
    }

    public void markProcessed(String batchId) {
        processedBatchIds.add(batchId);
        deferredBatchIds.remove(batchId);
    }

    public void defer(String batchId) {
        if (!processedBatchIds.contains(batchId)) {
            deferredBatchIds.add(batchId);
        }
    }

    public List<String> deferred() {
        return List.copyOf(deferredBatchIds);
    }

    public int processedCount() {
        return processedBatchIds.size();
    }
}
