package dao.fhe.settle.service;

import dao.fhe.settle.codec.EncryptedValueCodec;
import dao.fhe.settle.codec.NativeValue;
import dao.fhe.settle.config.EngineConfiguration;
import dao.fhe.settle.exception.DecryptionUnavailableException;
import dao.fhe.settle.exception.LedgerRejectedException;
import dao.fhe.settle.exception.NetworkTransientException;
import dao.fhe.settle.exception.QuorumNotMetException;
import dao.fhe.settle.exception.TypeMismatchException;
import dao.fhe.settle.exception.UnsupportedTagException;
import dao.fhe.settle.ledger.IntentStore;
import dao.fhe.settle.model.Batch;
import dao.fhe.settle.model.BatchState;
import dao.fhe.settle.model.CommitteeSignature;
import dao.fhe.settle.model.Intent;
import dao.fhe.settle.model.Settlement;
import dao.fhe.settle.service.BatchProcessingReport.Exclusion;
import dao.fhe.settle.service.BatchProcessingReport.Outcome;
import dao.fhe.settle.util.BackoffRetrier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Takes one finalized batch through decrypt, match, propose, attest and publish.
 * Matching state is rebuilt from ledger data on every call, so a deferred batch can
 * simply be processed again.
 */
@Slf4j
@Service
public class BatchSettlementService {

    private final IntentStore intentStore;
    private final EncryptedValueCodec codec;
    private final OrderMatcher matcher;
    private final ConsensusAggregator consensusAggregator;
    private final SettlementPublisher publisher;
    private final PeerAttestationAnnouncer announcer;
    private final BackoffRetrier decryptRetrier;
    private final Clock clock;

    // key: batchId, latest report
    private final Map<String, BatchProcessingReport> reports = new ConcurrentHashMap<>();

    public BatchSettlementService(IntentStore intentStore,
                                  EncryptedValueCodec codec,
                                  OrderMatcher matcher,
                                  ConsensusAggregator consensusAggregator,
                                  SettlementPublisher publisher,
                                  PeerAttestationAnnouncer announcer,
                                  @Qualifier(EngineConfiguration.DECRYPT_RETRIER) BackoffRetrier decryptRetrier,
                                  Clock clock) {
        this.intentStore = intentStore;
        this.codec = codec;
        this.matcher = matcher;
        this.consensusAggregator = consensusAggregator;
        this.publisher = publisher;
        this.announcer = announcer;
        this.decryptRetrier = decryptRetrier;
        this.clock = clock;
    }

    /**
     * @throws DecryptionUnavailableException decryption still failing after retries; defer the batch
     * @throws NetworkTransientException ledger unreachable while reading the batch; defer it
     */
    public BatchProcessingReport processFinalizedBatch(String batchId) {
        long now = clock.millis() / 1000L;
        Batch batch = intentStore.getBatch(batchId)
                .orElseThrow(() -> new IllegalArgumentException("Batch not found: " + batchId));
        if (batch.getState() == BatchState.SETTLED) {
            log.info("Batch {} already settled, skipping", batchId);
            return record(BatchProcessingReport.skipped(batchId, Outcome.ALREADY_SETTLED, now));
        }
        if (batch.getState() != BatchState.FINALIZED) {
            log.warn("Batch {} is {}, not processing", batchId, batch.getState());
            return record(BatchProcessingReport.skipped(batchId, Outcome.NOT_FINALIZED, now));
        }

        long expiryReference = batch.getFinalizedAt() > 0 ? batch.getFinalizedAt() : now;
        List<ClearIntent> clear = new ArrayList<>();
        List<Exclusion> excluded = new ArrayList<>();
        for (String intentId : batch.getIntentIds()) {
            Optional<ClearIntent> decrypted = decryptIntent(intentId, expiryReference, excluded);
            decrypted.ifPresent(clear::add);
        }

        MatchResult result = matcher.match(clear);
        ConservationCheck.verify(clear, result);

        Settlement settlement = new Settlement(batchId, result.transfers(), result.netSwaps(), List.of());
        String hash = consensusAggregator.propose(settlement);
        QuorumStatus status = consensusAggregator.signOwn(hash);
        announceOwn(hash);

        PublishAck ack = null;
        Outcome outcome = Outcome.PENDING_QUORUM;
        if (status.reached()) {
            Optional<PublishAck> published = tryPublish(hash);
            ack = published.orElse(null);
            outcome = published.isPresent() ? Outcome.PUBLISHED : Outcome.PENDING_LEDGER;
        } else {
            log.warn("Batch {} waiting for quorum ({}/{})", batchId, status.attestations(), status.required());
        }

        return record(new BatchProcessingReport(batchId, outcome, hash, clear.size(),
                result.transfers().size(), result.netSwaps().size(), excluded, ack, now));
    }

    /**
     * Publishes proposals that reached quorum and re-announces the ones that did not.
     */
    public void retryPending() {
        consensusAggregator.expireStale(clock.millis() / 1000L);
        for (QuorumStatus pending : consensusAggregator.pending()) {
            if (pending.reached()) {
                tryPublish(pending.settlementHash()).ifPresent(ack -> updateReport(pending, ack));
            } else {
                log.info("Re-announcing attestation for batch {} ({}/{})",
                        pending.batchId(), pending.attestations(), pending.required());
                announceOwn(pending.settlementHash());
            }
        }
    }

    public Optional<BatchProcessingReport> report(String batchId) {
        return Optional.ofNullable(reports.get(batchId));
    }

    public List<BatchProcessingReport> reports() {
        return new ArrayList<>(reports.values());
    }

    private Optional<ClearIntent> decryptIntent(String intentId, long expiryReference, List<Exclusion> excluded) {
        Intent intent;
        try {
            intent = intentStore.getIntent(intentId).orElse(null);
        } catch (UnsupportedTagException e) {
            return exclude(excluded, intentId, e.getMessage());
        }
        if (intent == null) {
            return exclude(excluded, intentId, "intent not found on ledger");
        }
        if (intent.isExpiredAt(expiryReference)) {
            return exclude(excluded, intentId, "expired at " + intent.getDeadline());
        }
        try {
            NativeValue amount = decryptRetrier.call("decrypt intent " + intentId,
                    DecryptionUnavailableException.class,
                    () -> codec.decode(intent.getEncryptedAmount(), Intent.AMOUNT_TAG));
            return Optional.of(new ClearIntent(intent.getId(), intent.getSubmitter(), intent.getTokenIn(),
                    intent.getTokenOut(), ((NativeValue.UintValue) amount).value()));
        } catch (TypeMismatchException | UnsupportedTagException e) {
            return exclude(excluded, intentId, e.getMessage());
        }
    }

    private static Optional<ClearIntent> exclude(List<Exclusion> excluded, String intentId, String reason) {
        log.warn("Intent {} excluded from matching: {}", intentId, reason);
        excluded.add(new Exclusion(intentId, reason));
        return Optional.empty();
    }

    private Optional<PublishAck> tryPublish(String hash) {
        Optional<Settlement> settlement = consensusAggregator.settlement(hash);
        if (settlement.isEmpty()) {
            return Optional.empty();
        }
        List<CommitteeSignature> signatures = consensusAggregator.signatures(hash);
        try {
            PublishAck ack = publisher.publish(settlement.get(), signatures);
            consensusAggregator.complete(hash);
            return Optional.of(ack);
        } catch (QuorumNotMetException e) {
            log.warn("Batch {} pending: {}", settlement.get().batchId(), e.getMessage());
        } catch (LedgerRejectedException e) {
            log.warn("Batch {} pending after ledger rejection: {}", settlement.get().batchId(), e.getMessage());
        } catch (NetworkTransientException | DecryptionUnavailableException e) {
            log.warn("Batch {} pending, publish interrupted: {}", settlement.get().batchId(), e.getMessage());
        }
        return Optional.empty();
    }

    private void announceOwn(String hash) {
        Optional<CommitteeSignature> own = consensusAggregator.ownAttestation(hash);
        Optional<Settlement> settlement = consensusAggregator.settlement(hash);
        if (own.isPresent() && settlement.isPresent()) {
            announcer.announce(new AttestationMessage(settlement.get().batchId(), hash,
                    own.get().operator(), own.get().signature()));
        }
    }

    private void updateReport(QuorumStatus status, PublishAck ack) {
        reports.computeIfPresent(status.batchId(), (id, r) -> new BatchProcessingReport(id, Outcome.PUBLISHED,
                r.settlementHash(), r.matchedIntents(), r.transfers(), r.netSwaps(), r.excluded(), ack, r.processedAt()));
    }

    private BatchProcessingReport record(BatchProcessingReport report) {
        reports.put(report.batchId(), report);
        return report;
    }
}
