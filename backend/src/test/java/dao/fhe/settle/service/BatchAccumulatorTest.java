package dao.fhe.settle.service;

import dao.fhe.settle.event.BatchFinalizedEvent;
import dao.fhe.settle.exception.UnauthorizedFinalizerException;
import dao.fhe.settle.ledger.IntentSubmission;
import dao.fhe.settle.model.Batch;
import dao.fhe.settle.model.BatchState;
import dao.fhe.settle.model.FinalizationTrigger;
import dao.fhe.settle.model.Intent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static dao.fhe.settle.service.EngineFixture.ALICE;
import static dao.fhe.settle.service.EngineFixture.BOB;
import static dao.fhe.settle.service.EngineFixture.POOL;
import static dao.fhe.settle.service.EngineFixture.USDC;
import static dao.fhe.settle.service.EngineFixture.USDT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchAccumulatorTest {

    private static final String OUTSIDER = "0x9999999999999999999999999999999999999999";

    @Test
    @DisplayName("Reaching max intents finalizes the batch immediately")
    void sizeTrigger() {
        EngineFixture f = new EngineFixture(3, 1, List.of());
        f.submit(ALICE, USDC, USDT, 1);
        String batchId = f.openBatchId();
        f.submit(BOB, USDT, USDC, 2);
        f.submit(ALICE, USDC, USDT, 3);

        Batch batch = f.batchRepository.findById(batchId).orElseThrow();
        assertEquals(BatchState.FINALIZED, batch.getState());
        assertEquals(FinalizationTrigger.MAX_INTENTS, batch.getFinalizationTrigger());
        assertEquals(3, batch.getIntentIds().size());
        assertTrue(f.accumulator.getOpenBatch(POOL).isEmpty());
        assertEquals(1, f.accumulator.finalizedBetween(0, Long.MAX_VALUE).size());
    }

    @Test
    @DisplayName("tryFinalize succeeds once the block interval has elapsed")
    void blockIntervalTrigger() {
        EngineFixture f = new EngineFixture();
        f.submit(ALICE, USDC, USDT, 1);
        String batchId = f.openBatchId();

        f.blockClock.advanceBlocks(4);
        assertFalse(f.accumulator.tryFinalize(batchId));

        f.blockClock.advanceBlocks(1);
        assertTrue(f.accumulator.tryFinalize(batchId));
        Batch batch = f.batchRepository.findById(batchId).orElseThrow();
        assertEquals(FinalizationTrigger.BLOCK_INTERVAL, batch.getFinalizationTrigger());
        assertEquals(6, batch.getFinalizedBlock());
    }

    @Test
    @DisplayName("Submitting past the interval finalizes the old batch and opens a new one")
    void submitAfterIntervalRollsBatch() {
        EngineFixture f = new EngineFixture();
        f.submit(ALICE, USDC, USDT, 1);
        String first = f.openBatchId();

        f.blockClock.advanceBlocks(5);
        f.submit(BOB, USDT, USDC, 1);
        String second = f.openBatchId();

        assertNotEquals(first, second);
        assertEquals(BatchState.FINALIZED, f.batchRepository.findById(first).orElseThrow().getState());
        assertEquals(1, f.batchRepository.findById(second).orElseThrow().getIntentIds().size());
    }

    @Test
    void forceFinalizeRequiresPrivilegeAndIdleTime() {
        EngineFixture f = new EngineFixture();
        f.submit(ALICE, USDC, USDT, 1);
        String batchId = f.openBatchId();
        String operator = f.operator.address();

        assertThrows(UnauthorizedFinalizerException.class, () -> f.accumulator.forceFinalize(batchId, OUTSIDER));
        f.blockClock.advanceSeconds(59);
        assertFalse(f.accumulator.forceFinalize(batchId, operator));

        f.blockClock.advanceSeconds(1);
        assertTrue(f.accumulator.forceFinalize(batchId, operator));
        assertEquals(FinalizationTrigger.IDLE_TIMEOUT,
                f.batchRepository.findById(batchId).orElseThrow().getFinalizationTrigger());
    }

    @Test
    void configuredFinalizersArePrivileged() {
        EngineFixture f = new EngineFixture();
        f.batchProps.getPrivilegedFinalizers().add(OUTSIDER);
        BatchAccumulator accumulator = new BatchAccumulator(f.batchRepository, f.intentRepository, f.batchProps,
                f.blockClock, f.operator);
        f.submit(ALICE, USDC, USDT, 1);

        assertTrue(accumulator.adminFinalize(f.openBatchId(), OUTSIDER));
    }

    @Test
    @DisplayName("Finalizing twice emits a single event and both calls report success")
    void finalizeIsIdempotent() {
        EngineFixture f = new EngineFixture();
        f.submit(ALICE, USDC, USDT, 1);
        String batchId = f.openBatchId();

        assertTrue(f.accumulator.adminFinalize(batchId, f.operator.address()));
        assertTrue(f.accumulator.adminFinalize(batchId, f.operator.address()));
        assertTrue(f.accumulator.tryFinalize(batchId));

        assertEquals(1, f.accumulator.finalizedBetween(0, Long.MAX_VALUE).size());
        assertEquals(FinalizationTrigger.ADMIN_OVERRIDE,
                f.batchRepository.findById(batchId).orElseThrow().getFinalizationTrigger());
    }

    @Test
    @DisplayName("Racing finalizers both observe success, one event is emitted")
    void racingFinalizers() throws Exception {
        EngineFixture f = new EngineFixture();
        f.submit(ALICE, USDC, USDT, 1);
        String batchId = f.openBatchId();
        f.blockClock.advanceBlocks(5);
        f.blockClock.advanceSeconds(120);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                boolean viaIdle = i % 2 == 0;
                results.add(pool.submit(() -> {
                    start.await();
                    return viaIdle
                            ? f.accumulator.forceFinalize(batchId, f.operator.address())
                            : f.accumulator.tryFinalize(batchId);
                }));
            }
            start.countDown();
            for (Future<Boolean> result : results) {
                assertTrue(result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, f.accumulator.finalizedBetween(0, Long.MAX_VALUE).size());
    }

    @Test
    void expiredIntentIsRejected() {
        EngineFixture f = new EngineFixture();
        long past = f.blockClock.nowSeconds() - 1;

        assertThrows(IllegalArgumentException.class, () -> f.submit(ALICE, USDC, USDT,
                f.cipher.encrypt(BigInteger.TEN, Intent.AMOUNT_TAG), past));
        assertEquals(0, f.intentRepository.count());
    }

    @Test
    void markSettledFollowsStateMachine() {
        EngineFixture f = new EngineFixture();
        f.submit(ALICE, USDC, USDT, 1);
        String batchId = f.openBatchId();

        assertThrows(IllegalStateException.class, () -> f.accumulator.markSettled(batchId));
        f.accumulator.adminFinalize(batchId, f.operator.address());
        assertTrue(f.accumulator.markSettled(batchId));
        assertFalse(f.accumulator.markSettled(batchId));
        assertEquals(BatchState.SETTLED, f.batchRepository.findById(batchId).orElseThrow().getState());
    }

    @Test
    void poolsBatchIndependently() {
        EngineFixture f = new EngineFixture();
        String otherPool = "0x" + "02".repeat(32);
        f.submit(ALICE, USDC, USDT, 1);
        f.store.submitIntent(new IntentSubmission(otherPool, BOB, USDT, USDC,
                f.cipher.encrypt(BigInteger.ONE, Intent.AMOUNT_TAG), f.blockClock.nowSeconds() + 60));

        assertEquals(2, f.accumulator.openBatches().size());
        assertNotEquals(f.openBatchId(), f.accumulator.getOpenBatch(otherPool).orElseThrow().getId());
    }

    @Test
    void finalizedEventsAreFilteredByBlock() {
        EngineFixture f = new EngineFixture();
        f.submit(ALICE, USDC, USDT, 1);
        f.accumulator.adminFinalize(f.openBatchId(), f.operator.address());
        f.blockClock.advanceBlocks(10);
        f.submit(BOB, USDT, USDC, 1);
        f.accumulator.adminFinalize(f.openBatchId(), f.operator.address());

        assertEquals(1, f.accumulator.finalizedBetween(0, 5).size());
        assertEquals(1, f.accumulator.finalizedBetween(6, 20).size());
        assertEquals(2, f.accumulator.finalizedBetween(1, 11).size());
    }

    @Test
    @DisplayName("Finalized events older than the retention window are pruned")
    void oldFinalizedEventsArePruned() {
        EngineFixture f = new EngineFixture();
        f.batchProps.setEventRetentionBlocks(10);
        f.submit(ALICE, USDC, USDT, 1);
        String old = f.openBatchId();
        f.accumulator.adminFinalize(old, f.operator.address());
        f.blockClock.advanceBlocks(20);
        f.submit(BOB, USDT, USDC, 1);
        String recent = f.openBatchId();
        f.accumulator.adminFinalize(recent, f.operator.address());

        List<BatchFinalizedEvent> events = f.accumulator.finalizedBetween(0, Long.MAX_VALUE);
        assertEquals(1, events.size());
        assertEquals(recent, events.get(0).batchId());
        assertEquals(BatchState.FINALIZED, f.batchRepository.findById(old).orElseThrow().getState());
    }

    @Test
    @DisplayName("Batches handed out are snapshots unaffected by later submits")
    void returnedBatchesAreSnapshots() {
        EngineFixture f = new EngineFixture();
        f.submit(ALICE, USDC, USDT, 1);
        Batch before = f.accumulator.getOpenBatch(POOL).orElseThrow();
        f.submit(BOB, USDT, USDC, 1);

        assertEquals(1, before.getIntentIds().size());
        assertEquals(2, f.accumulator.getOpenBatch(POOL).orElseThrow().getIntentIds().size());

        before.getIntentIds().clear();
        before.setState(BatchState.SETTLED);
        Batch stored = f.store.getBatch(before.getId()).orElseThrow();
        assertEquals(2, stored.getIntentIds().size());
        assertEquals(BatchState.OPEN, stored.getState());
    }
}
