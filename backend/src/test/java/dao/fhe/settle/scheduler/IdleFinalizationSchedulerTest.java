package dao.fhe.settle.scheduler;

import dao.fhe.settle.config.BatchProperties;
import dao.fhe.settle.config.SchedulerProperties;
import dao.fhe.settle.ledger.ManualBlockClock;
import dao.fhe.settle.model.EncryptedValue;
import dao.fhe.settle.model.Intent;
import dao.fhe.settle.model.TypeTag;
import dao.fhe.settle.repository.InMemoryBatchRepository;
import dao.fhe.settle.repository.InMemoryIntentRepository;
import dao.fhe.settle.service.BatchAccumulator;
import dao.fhe.settle.service.OperatorIdentity;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.ECKeyPair;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdleFinalizationSchedulerTest {

    private static final String POOL = "0x" + "05".repeat(32);

    @Test
    void evaluate_finalizesIdleAndExpiredIntervalBatches() {
        ManualBlockClock clock = new ManualBlockClock(1, 1_700_000_000L);
        BatchProperties props = new BatchProperties();
        props.setBlockInterval(5);
        props.setMaxIdleSeconds(60);
        OperatorIdentity operator = new OperatorIdentity(ECKeyPair.create(BigInteger.valueOf(99)));
        BatchAccumulator accumulator = new BatchAccumulator(new InMemoryBatchRepository(),
                new InMemoryIntentRepository(), props, clock, operator);
        IdleFinalizationScheduler scheduler = new IdleFinalizationScheduler(accumulator, operator, new SchedulerProperties());

        accumulator.submit(intent("0x" + "a1".repeat(32), clock.nowSeconds() + 3600));
        assertEquals(0, scheduler.evaluate());

        clock.advanceSeconds(61);
        assertEquals(1, scheduler.evaluate());
        assertTrue(accumulator.openBatches().isEmpty());
    }

    private static Intent intent(String id, long deadline) {
        return Intent.builder()
                .id(id)
                .poolId(POOL)
                .submitter("0x1111111111111111111111111111111111111111")
                .tokenIn("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48")
                .tokenOut("0xdAC17F958D2ee523a2206206994597C13D831ec7")
                .encryptedAmount(EncryptedValue.of(BigInteger.ONE, TypeTag.UINT128))
                .deadline(deadline)
                .build();
    }
}
