package dao.fhe.settle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private FinalizationConfig finalization = new FinalizationConfig();
    private IdleConfig idle = new IdleConfig();

    @Data
    public static class FinalizationConfig {
        /**
         * Enable/disable the BatchFinalized poller
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often to scan for new BatchFinalized events (in milliseconds)
         * Default: 5000ms
         */
        private long checkIntervalMs = 5000;

        /**
         * How far behind head the cursor starts on startup
         * Default: 1000 blocks
         */
        private long backfillBlocks = 1000;
    }

    @Data
    public static class IdleConfig {
        /**
         * Enable/disable the local idle/block-interval finalizer
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often to evaluate open batches (in milliseconds)
         * Default: 30000ms
         */
        private long checkIntervalMs = 30000;
    }
}
