package dao.fhe.settle.repository;

import dao.fhe.settle.model.Batch;
import dao.fhe.settle.model.BatchState;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores a snapshot on every save and hands out copies, so callers never share a
 * {@link Batch} instance with the accumulator.
 */
@Repository
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "local", matchIfMissing = true)
public class InMemoryBatchRepository implements BatchRepository {

    // key: batchId
    private final Map<String, Batch> batchesById = new ConcurrentHashMap<>();

    // key: poolId -> id of its single OPEN batch
    private final Map<String, String> openBatchIdByPool = new ConcurrentHashMap<>();

    @Override
    public synchronized void save(Batch batch) {
        batchesById.put(batch.getId(), batch.copy());
        if (batch.getState() == BatchState.OPEN) {
            openBatchIdByPool.put(batch.getPoolId(), batch.getId());
        } else {
            openBatchIdByPool.remove(batch.getPoolId(), batch.getId());
        }
    }

    @Override
    public List<Batch> findAll() {
        List<Batch> all = new ArrayList<>();
        batchesById.values().forEach(b -> all.add(b.copy()));
        all.sort(Comparator.comparingLong(Batch::getCreatedBlock).thenComparing(Batch::getId));
        return all;
    }

    @Override
    public Optional<Batch> findById(String batchId) {
        return Optional.ofNullable(batchesById.get(batchId)).map(Batch::copy);
    }

    @Override
    public Optional<Batch> findOpenByPool(String poolId) {
        String batchId = openBatchIdByPool.get(poolId);
        if (batchId == null) return Optional.empty();
        return Optional.ofNullable(batchesById.get(batchId)).map(Batch::copy);
    }

    @Override
    public List<Batch> findByState(BatchState state) {
        return findAll().stream().filter(b -> b.getState() == state).toList();
    }
}
