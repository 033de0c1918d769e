package dao.fhe.settle.ledger;

import dao.fhe.settle.config.ConsensusProperties;
import dao.fhe.settle.event.BatchFinalizedEvent;
import dao.fhe.settle.exception.LedgerRejectedException;
import dao.fhe.settle.model.Batch;
import dao.fhe.settle.model.BatchState;
import dao.fhe.settle.model.Intent;
import dao.fhe.settle.repository.BatchRepository;
import dao.fhe.settle.repository.IntentRepository;
import dao.fhe.settle.service.BatchAccumulator;
import dao.fhe.settle.service.OperatorIdentity;
import dao.fhe.settle.util.EthSignatures;
import dao.fhe.settle.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Keys;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process ledger backed by the {@link BatchAccumulator}. The block being built is never
 * reported as current, so events emitted during it are seen on the next scan.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "local", matchIfMissing = true)
public class LocalIntentStore implements IntentStore {

    private final BatchAccumulator accumulator;
    private final BatchRepository batchRepository;
    private final IntentRepository intentRepository;
    private final BlockClock blockClock;
    private final ConsensusProperties consensusProps;
    private final OperatorIdentity operator;

    private final Map<String, PublishedSettlement> settlements = new ConcurrentHashMap<>();
    private final AtomicLong intentSeq = new AtomicLong(1);

    public LocalIntentStore(BatchAccumulator accumulator,
                            BatchRepository batchRepository,
                            IntentRepository intentRepository,
                            BlockClock blockClock,
                            ConsensusProperties consensusProps,
                            OperatorIdentity operator) {
        this.accumulator = accumulator;
        this.batchRepository = batchRepository;
        this.intentRepository = intentRepository;
        this.blockClock = blockClock;
        this.consensusProps = consensusProps;
        this.operator = operator;
    }

    @Override
    public String submitIntent(IntentSubmission submission) {
        String poolId = HexUtil.normalizeBytes32(submission.poolId());
        String intentId = HexUtil.keccakOf("intent", poolId, submission.submitter(), intentSeq.getAndIncrement());
        Intent intent = Intent.builder()
                .id(intentId)
                .submitter(Keys.toChecksumAddress(submission.submitter()))
                .tokenIn(Keys.toChecksumAddress(submission.tokenIn()))
                .tokenOut(Keys.toChecksumAddress(submission.tokenOut()))
                .encryptedAmount(submission.encryptedAmount())
                .poolId(poolId)
                .submittedAt(blockClock.nowSeconds())
                .submittedBlock(blockClock.currentBlock())
                .deadline(submission.deadline())
                .build();
        String batchId = accumulator.submit(intent);
        log.info("Intent {} accepted into batch {}", intentId, batchId);
        return intentId;
    }

    @Override
    public long currentBlock() {
        return Math.max(0, blockClock.currentBlock() - 1);
    }

    @Override
    public List<BatchFinalizedEvent> findBatchFinalized(long fromBlock, long toBlock) {
        return accumulator.finalizedBetween(fromBlock, toBlock);
    }

    @Override
    public Optional<Batch> getBatch(String batchId) {
        return batchRepository.findById(batchId);
    }

    @Override
    public Optional<Intent> getIntent(String intentId) {
        return intentRepository.findById(intentId);
    }

    @Override
    public SettlementReceipt submitSettlement(PublishedSettlement settlement) {
        Batch batch = batchRepository.findById(settlement.batchId())
                .orElseThrow(() -> new LedgerRejectedException("Unknown batch " + settlement.batchId()));
        if (batch.getState() != BatchState.FINALIZED) {
            throw new LedgerRejectedException("Batch " + batch.getId() + " is " + batch.getState() + ", expected FINALIZED");
        }
        long signers = settlement.signatures().stream()
                .filter(s -> isCommitteeMemberSelected(batch.getId(), s.operator()))
                .filter(s -> EthSignatures.recoverSigner(settlement.settlementHash(), s.signature())
                        .filter(r -> EthSignatures.sameAddress(r, s.operator()))
                        .isPresent())
                .map(s -> s.operator().toLowerCase())
                .distinct()
                .count();
        if (signers < Math.max(1, consensusProps.getMinAttestations())) {
            throw new LedgerRejectedException("Settlement for batch " + batch.getId() + " carries " + signers + " valid committee signatures");
        }

        accumulator.markSettled(batch.getId());
        settlements.put(batch.getId(), settlement);
        String txHash = HexUtil.keccakOf("settle", batch.getId(), settlement.settlementHash());
        return new SettlementReceipt(batch.getId(), txHash, blockClock.currentBlock());
    }

    @Override
    public boolean isCommitteeMemberSelected(String batchId, String operatorAddress) {
        List<String> committee = consensusProps.getCommittee();
        if (committee == null || committee.isEmpty()) {
            return EthSignatures.sameAddress(operator.address(), operatorAddress);
        }
        return committee.stream().anyMatch(member -> EthSignatures.sameAddress(member, operatorAddress));
    }

    public Optional<PublishedSettlement> findSettlement(String batchId) {
        return Optional.ofNullable(settlements.get(batchId));
    }
}
