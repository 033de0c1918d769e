package dao.fhe.settle.config;

import lombok.Data;

@Data
public class RetrySettings {
    /**
     * Total attempts including the first one
     * Default: 5
     */
    private int maxAttempts = 5;

    /**
     * Delay before the second attempt; grows x1.5 per attempt
     * Default: 500ms
     */
    private long initialBackoffMs = 500;

    /**
     * Upper bound for a single delay
     * Default: 8000ms
     */
    private long maxBackoffMs = 8000;
}
