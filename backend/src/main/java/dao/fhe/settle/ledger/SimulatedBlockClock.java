package dao.fhe.settle.ledger;

import dao.fhe.settle.config.BatchProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Derives block numbers from wall time: block 1 starts when the engine starts and a new
 * block begins every batch.block-time-seconds.
 */
@Component
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "local", matchIfMissing = true)
public class SimulatedBlockClock implements BlockClock {

    private final Clock clock;
    private final long genesisMillis;
    private final long blockTimeMillis;

    public SimulatedBlockClock(Clock clock, BatchProperties props) {
        this.clock = clock;
        this.genesisMillis = clock.millis();
        this.blockTimeMillis = Math.max(1, props.getBlockTimeSeconds()) * 1000L;
    }

    @Override
    public long currentBlock() {
        return (clock.millis() - genesisMillis) / blockTimeMillis + 1;
    }

    @Override
    public long nowSeconds() {
        return clock.millis() / 1000L;
    }
}
