package dao.fhe.settle.util;

import dao.fhe.settle.exception.LedgerRejectedException;
import dao.fhe.settle.exception.NetworkTransientException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackoffRetrierTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final BackoffRetrier retrier = new BackoffRetrier(5, 500, 1000, sleeps::add);

    @Test
    void call_retriesUntilSuccessWithGrowingBackoff() {
        AtomicInteger calls = new AtomicInteger();

        String result = retrier.call("read head", NetworkTransientException.class, () -> {
            if (calls.incrementAndGet() < 4) {
                throw new NetworkTransientException("timeout");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(4, calls.get());
        assertEquals(3, sleeps.size());
        assertInRange(sleeps.get(0), 500);
        assertInRange(sleeps.get(1), 750);
        assertInRange(sleeps.get(2), 1000);
    }

    @Test
    void call_givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(NetworkTransientException.class, () -> retrier.call("read head", NetworkTransientException.class, () -> {
            calls.incrementAndGet();
            throw new NetworkTransientException("down");
        }));
        assertEquals(5, calls.get());
        assertEquals(4, sleeps.size());
    }

    @Test
    void call_otherExceptionsPropagateImmediately() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(LedgerRejectedException.class, () -> retrier.run("settle", NetworkTransientException.class, () -> {
            calls.incrementAndGet();
            throw new LedgerRejectedException("reverted");
        }));
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void constructor_rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffRetrier(0, 1, 1));
        assertEquals(3, BackoffRetrier.immediate(3).getMaxAttempts());
    }

    private static void assertInRange(long actual, long base) {
        assertTrue(actual >= base && actual < base + 150, "sleep " + actual + " not in [" + base + ", " + (base + 150) + ")");
    }
}
