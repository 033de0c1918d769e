package dao.fhe.settle.util;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff (x1.5, capped) and 0-150 ms jitter.
 * Only exceptions of the configured type are retried; everything else propagates at once.
 */
@Slf4j
public class BackoffRetrier {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final Sleeper sleeper;

    public BackoffRetrier(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
        this(maxAttempts, initialBackoffMs, maxBackoffMs, Thread::sleep);
    }

    public BackoffRetrier(int maxAttempts, long initialBackoffMs, long maxBackoffMs, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
        this.maxBackoffMs = Math.max(this.initialBackoffMs, maxBackoffMs);
        this.sleeper = sleeper;
    }

    /** Retrier that never sleeps; for tests and in-process adapters. */
    public static BackoffRetrier immediate(int maxAttempts) {
        return new BackoffRetrier(maxAttempts, 0, 0, millis -> { });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public <T> T call(String operation, Class<? extends RuntimeException> retryOn, Supplier<T> action) {
        long sleepMs = initialBackoffMs;
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!retryOn.isInstance(e) || attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("{} failed (attempt {}/{}): {}", operation, attempt, maxAttempts, e.getMessage());
                try {
                    long jitter = sleepMs > 0 ? ThreadLocalRandom.current().nextLong(0, 150) : 0;
                    sleeper.sleep(sleepMs + jitter);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                sleepMs = Math.min(maxBackoffMs, (long) Math.ceil(sleepMs * 1.5));
                attempt++;
            }
        }
    }

    public void run(String operation, Class<? extends RuntimeException> retryOn, Runnable action) {
        call(operation, retryOn, () -> {
            action.run();
            return null;
        });
    }
}
