package dao.fhe.settle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "batch")
public class BatchProperties {

    /**
     * Blocks after creation at which an open batch becomes finalizable
     * Default: 5
     */
    private long blockInterval = 5;

    /**
     * Size trigger: reaching this many intents finalizes the batch immediately
     * Default: 16
     */
    private int maxIntents = 16;

    /**
     * Idle time after the last intent before a privileged caller may force finalization
     * Default: 60 seconds
     */
    private long maxIdleSeconds = 60;

    /**
     * Simulated block time of the local ledger
     * Default: 2 seconds
     */
    private long blockTimeSeconds = 2;

    /**
     * Local ledger only: BatchFinalized events older than this many blocks are dropped.
     * Must stay above scheduler.finalization.backfill-blocks.
     * Default: 10000
     */
    private long eventRetentionBlocks = 10_000;

    /** Addresses allowed to force or override finalization, in addition to the operator. */
    private List<String> privilegedFinalizers = new ArrayList<>();
}
