package dao.fhe.settle.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class Batch {

    private String id;
    private String poolId;
    private long createdBlock;
    private long createdAt;      // unix seconds
    private long lastIntentAt;   // unix seconds, drives the idle trigger
    /** Intent ids in ledger submission order. */
    private List<String> intentIds = new ArrayList<>();
    private BatchState state = BatchState.OPEN;
    private long finalizedBlock;
    /**
     * Unix seconds at finalization. Expiry of the batch's intents is judged against this
     * instant so every committee member excludes the same intents.
     */
    private long finalizedAt;
    private FinalizationTrigger finalizationTrigger;

    /** Independent copy, intent list included. */
    public Batch copy() {
        Batch copy = new Batch();
        copy.setId(id);
        copy.setPoolId(poolId);
        copy.setCreatedBlock(createdBlock);
        copy.setCreatedAt(createdAt);
        copy.setLastIntentAt(lastIntentAt);
        copy.setIntentIds(new ArrayList<>(intentIds));
        copy.setState(state);
        copy.setFinalizedBlock(finalizedBlock);
        copy.setFinalizedAt(finalizedAt);
        copy.setFinalizationTrigger(finalizationTrigger);
        return copy;
    }

    public boolean isEmpty() {
        return intentIds.isEmpty();
    }
}
