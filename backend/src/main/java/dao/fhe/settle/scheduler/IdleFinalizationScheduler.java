package dao.fhe.settle.scheduler;

import dao.fhe.settle.config.SchedulerProperties;
import dao.fhe.settle.model.Batch;
import dao.fhe.settle.service.BatchAccumulator;
import dao.fhe.settle.service.OperatorIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Local ledger keeper: applies the block-interval trigger to every open batch and, failing
 * that, the idle trigger as the operator.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "local", matchIfMissing = true)
public class IdleFinalizationScheduler {

    private final BatchAccumulator accumulator;
    private final OperatorIdentity operator;
    private final SchedulerProperties schedulerProps;

    public IdleFinalizationScheduler(BatchAccumulator accumulator,
                                     OperatorIdentity operator,
                                     SchedulerProperties schedulerProps) {
        this.accumulator = accumulator;
        this.operator = operator;
        this.schedulerProps = schedulerProps;
    }

    @Scheduled(fixedDelayString = "${scheduler.idle.check-interval-ms:30000}")
    public void checkOpenBatches() {
        if (!schedulerProps.getIdle().isEnabled()) {
            return;
        }
        evaluate();
    }

    /** @return number of batches finalized by this pass */
    public int evaluate() {
        List<Batch> open = accumulator.openBatches();
        int finalized = 0;
        for (Batch batch : open) {
            if (accumulator.tryFinalize(batch.getId())
                    || accumulator.forceFinalize(batch.getId(), operator.address())) {
                finalized++;
            }
        }
        if (finalized > 0) {
            log.info("Idle check finalized {}/{} open batches", finalized, open.size());
        }
        return finalized;
    }
}
