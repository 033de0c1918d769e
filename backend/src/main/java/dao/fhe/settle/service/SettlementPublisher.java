package dao.fhe.settle.service;

import dao.fhe.settle.cipher.ThresholdCipherService;
import dao.fhe.settle.exception.LedgerRejectedException;
import dao.fhe.settle.exception.QuorumNotMetException;
import dao.fhe.settle.ledger.IntentStore;
import dao.fhe.settle.ledger.PublishedSettlement;
import dao.fhe.settle.ledger.PublishedTransfer;
import dao.fhe.settle.ledger.SettlementReceipt;
import dao.fhe.settle.model.BatchState;
import dao.fhe.settle.model.CommitteeSignature;
import dao.fhe.settle.model.Intent;
import dao.fhe.settle.model.InternalizedTransfer;
import dao.fhe.settle.model.Settlement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes quorum-backed settlements to the ledger, at most once per batch per process.
 */
@Slf4j
@Service
public class SettlementPublisher {

    private final IntentStore intentStore;
    private final ConsensusAggregator consensusAggregator;
    private final SettlementHasher hasher;
    private final ThresholdCipherService cipherService;

    private final Set<String> attempted = ConcurrentHashMap.newKeySet();

    public SettlementPublisher(IntentStore intentStore,
                               ConsensusAggregator consensusAggregator,
                               SettlementHasher hasher,
                               ThresholdCipherService cipherService) {
        this.intentStore = intentStore;
        this.consensusAggregator = consensusAggregator;
        this.hasher = hasher;
        this.cipherService = cipherService;
    }

    /**
     * @throws QuorumNotMetException    fewer distinct valid signatures than required
     * @throws LedgerRejectedException  rejected twice; the batch stays pending
     */
    public PublishAck publish(Settlement settlement, List<CommitteeSignature> signatures) {
        String batchId = settlement.batchId();
        List<CommitteeSignature> valid = consensusAggregator.validSignatures(settlement, signatures);
        if (valid.size() < consensusAggregator.minAttestations()) {
            throw new QuorumNotMetException(batchId, valid.size(), consensusAggregator.minAttestations());
        }
        if (!attempted.add(batchId)) {
            log.debug("Settlement for batch {} already attempted, skipping", batchId);
            return PublishAck.alreadyAttempted(batchId);
        }

        try {
            if (isSettled(batchId)) {
                log.info("Batch {} already settled on the ledger", batchId);
                return PublishAck.alreadySettled(batchId);
            }
            PublishedSettlement payload = toPublished(settlement, valid);
            return submitWithRetry(payload);
        } catch (RuntimeException e) {
            attempted.remove(batchId);
            throw e;
        }
    }

    /** Allows a batch to be attempted again by this process. */
    public void evict(String batchId) {
        attempted.remove(batchId);
    }

    public boolean wasAttempted(String batchId) {
        return attempted.contains(batchId);
    }

    private PublishAck submitWithRetry(PublishedSettlement payload) {
        String batchId = payload.batchId();
        try {
            return submit(payload);
        } catch (LedgerRejectedException first) {
            log.warn("Ledger rejected settlement for batch {}: {}. Refreshing state and retrying once.",
                    batchId, first.getMessage());
            if (isSettled(batchId)) {
                return PublishAck.alreadySettled(batchId);
            }
            try {
                return submit(payload);
            } catch (LedgerRejectedException second) {
                log.error("ALERT ledger rejected settlement for batch {} twice: {}", batchId, second.getMessage());
                throw second;
            }
        }
    }

    private PublishAck submit(PublishedSettlement payload) {
        SettlementReceipt receipt = intentStore.submitSettlement(payload);
        log.info("Settlement published: batch={}, tx={}, transfers={}, netSwaps={}, signatures={}",
                payload.batchId(), receipt.txHash(), payload.transfers().size(),
                payload.netSwaps().size(), payload.signatures().size());
        return PublishAck.submitted(payload.batchId(), receipt.txHash());
    }

    private boolean isSettled(String batchId) {
        return intentStore.getBatch(batchId)
                .map(b -> b.getState() == BatchState.SETTLED)
                .orElse(false);
    }

    private PublishedSettlement toPublished(Settlement settlement, List<CommitteeSignature> signatures) {
        List<PublishedTransfer> transfers = new ArrayList<>();
        for (InternalizedTransfer t : settlement.internalizedTransfers()) {
            transfers.add(new PublishedTransfer(
                    t.intentIdA(), t.intentIdB(), t.userA(), t.userB(), t.tokenA(), t.tokenB(),
                    cipherService.encrypt(t.amountA(), Intent.AMOUNT_TAG),
                    cipherService.encrypt(t.amountB(), Intent.AMOUNT_TAG)));
        }
        return new PublishedSettlement(settlement.batchId(), hasher.hash(settlement), transfers,
                settlement.netSwaps(), signatures);
    }
}
