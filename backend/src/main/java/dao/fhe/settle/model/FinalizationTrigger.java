package dao.fhe.settle.model;

public enum FinalizationTrigger {
    /** Batch reached batch.max-intents. */
    MAX_INTENTS,
    /** batch.block-interval blocks elapsed since the batch was opened. */
    BLOCK_INTERVAL,
    /** Privileged caller forced a batch idle for longer than batch.max-idle-seconds. */
    IDLE_TIMEOUT,
    /** Administrative override, no idle requirement. */
    ADMIN_OVERRIDE
}
