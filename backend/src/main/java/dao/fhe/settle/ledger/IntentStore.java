package dao.fhe.settle.ledger;

import dao.fhe.settle.event.BatchFinalizedEvent;
import dao.fhe.settle.model.Batch;
import dao.fhe.settle.model.Intent;

import java.util.List;
import java.util.Optional;

/**
 * The authoritative ledger: intent registry, batch state machine and settlement sink.
 * All errors surface as {@link dao.fhe.settle.exception.SettlementEngineException} subtypes.
 */
public interface IntentStore {

    /** Registers an intent and returns its id. */
    String submitIntent(IntentSubmission submission);

    /** Latest block whose logs are final. */
    long currentBlock();

    /** BatchFinalized events in {@code [fromBlock, toBlock]}, in block order. */
    List<BatchFinalizedEvent> findBatchFinalized(long fromBlock, long toBlock);

    Optional<Batch> getBatch(String batchId);

    Optional<Intent> getIntent(String intentId);

    /**
     * Submits a signed settlement.
     *
     * @throws dao.fhe.settle.exception.LedgerRejectedException when the ledger refuses it
     */
    SettlementReceipt submitSettlement(PublishedSettlement settlement);

    boolean isCommitteeMemberSelected(String batchId, String operator);
}
