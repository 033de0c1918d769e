package dao.fhe.settle.service;

import dao.fhe.settle.config.ConsensusProperties;
import dao.fhe.settle.exception.UnauthorizedAttestationException;
import dao.fhe.settle.ledger.IntentStore;
import dao.fhe.settle.model.CommitteeSignature;
import dao.fhe.settle.model.Settlement;
import dao.fhe.settle.util.EthSignatures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Collects committee attestations per settlement hash and decides quorum.
 * A signature counts when it recovers to the claimed operator and the ledger reports that
 * operator as selected for the batch. Each operator counts once.
 * Proposals that never reach quorum are dropped after {@code consensus.proposal-ttl-seconds},
 * and at most {@code consensus.max-pending-proposals} are kept.
 */
@Slf4j
@Service
public class ConsensusAggregator {

    private final IntentStore intentStore;
    private final SettlementHasher hasher;
    private final OperatorIdentity operator;
    private final ConsensusProperties props;
    private final Clock clock;

    // key: settlement hash, insertion ordered
    private final Map<String, Proposal> proposals = new LinkedHashMap<>();

    public ConsensusAggregator(IntentStore intentStore,
                               SettlementHasher hasher,
                               OperatorIdentity operator,
                               ConsensusProperties props,
                               Clock clock) {
        this.intentStore = intentStore;
        this.hasher = hasher;
        this.operator = operator;
        this.props = props;
        this.clock = clock;
    }

    public int minAttestations() {
        return Math.max(1, props.getMinAttestations());
    }

    /** Registers the settlement for attestation and returns its hash. */
    public synchronized String propose(Settlement settlement) {
        String hash = hasher.hash(settlement);
        if (!proposals.containsKey(hash)) {
            evictOldestOverCapacity();
            proposals.put(hash, new Proposal(hash, settlement.withSignatures(List.of()), clock.millis() / 1000L));
            log.info("Settlement proposed: batch={}, hash={}, transfers={}, netSwaps={}",
                    settlement.batchId(), hash, settlement.internalizedTransfers().size(), settlement.netSwaps().size());
        }
        return hash;
    }

    /**
     * @throws NoSuchElementException            no proposal with this hash
     * @throws UnauthorizedAttestationException  bad signature or operator not selected
     */
    public synchronized QuorumStatus attest(String hash, String operatorAddress, String signature) {
        Proposal proposal = proposals.get(hash);
        if (proposal == null) {
            throw new NoSuchElementException("Unknown settlement hash: " + hash);
        }
        String batchId = proposal.settlement.batchId();
        if (!isValid(batchId, hash, new CommitteeSignature(operatorAddress, signature))) {
            throw new UnauthorizedAttestationException(
                    "Attestation from " + operatorAddress + " rejected for batch " + batchId);
        }

        boolean wasReached = proposal.attestations.size() >= minAttestations();
        CommitteeSignature previous = proposal.attestations.putIfAbsent(
                key(operatorAddress), new CommitteeSignature(operatorAddress, signature));
        if (previous != null) {
            log.debug("Duplicate attestation from {} for batch {} ignored", operatorAddress, batchId);
        }
        QuorumStatus status = statusOf(proposal);
        if (status.reached() && !wasReached) {
            log.info("Quorum reached for batch {} ({}/{})", batchId, status.attestations(), status.required());
        }
        return status;
    }

    public QuorumStatus signOwn(String hash) {
        CommitteeSignature own = operator.sign(hash);
        return attest(hash, own.operator(), own.signature());
    }

    public synchronized Optional<CommitteeSignature> ownAttestation(String hash) {
        Proposal proposal = proposals.get(hash);
        if (proposal == null) return Optional.empty();
        return Optional.ofNullable(proposal.attestations.get(key(operator.address())));
    }

    public synchronized boolean isQuorumReached(String hash) {
        Proposal proposal = proposals.get(hash);
        return proposal != null && statusOf(proposal).reached();
    }

    public synchronized Optional<QuorumStatus> status(String hash) {
        return Optional.ofNullable(proposals.get(hash)).map(this::statusOf);
    }

    public synchronized List<CommitteeSignature> signatures(String hash) {
        Proposal proposal = proposals.get(hash);
        return proposal == null ? List.of() : List.copyOf(proposal.attestations.values());
    }

    public synchronized Optional<Settlement> settlement(String hash) {
        return Optional.ofNullable(proposals.get(hash)).map(p -> p.settlement);
    }

    /** Distinct valid signatures over {@code settlement}, in the order given. */
    public List<CommitteeSignature> validSignatures(Settlement settlement, List<CommitteeSignature> signatures) {
        String hash = hasher.hash(settlement);
        Set<String> seen = new LinkedHashSet<>();
        List<CommitteeSignature> valid = new ArrayList<>();
        for (CommitteeSignature sig : signatures) {
            if (sig.operator() == null || seen.contains(key(sig.operator()))) continue;
            if (isValid(settlement.batchId(), hash, sig)) {
                seen.add(key(sig.operator()));
                valid.add(sig);
            }
        }
        return valid;
    }

    public int countValid(Settlement settlement, List<CommitteeSignature> signatures) {
        return validSignatures(settlement, signatures).size();
    }

    /** Proposals not yet completed, oldest first. */
    public synchronized List<QuorumStatus> pending() {
        return proposals.values().stream().map(this::statusOf).toList();
    }

    /**
     * Drops proposals still below quorum that are older than the configured TTL.
     *
     * @return number of proposals dropped
     */
    public synchronized int expireStale(long nowSeconds) {
        int dropped = 0;
        Iterator<Proposal> it = proposals.values().iterator();
        while (it.hasNext()) {
            Proposal proposal = it.next();
            boolean belowQuorum = proposal.attestations.size() < minAttestations();
            if (belowQuorum && nowSeconds - proposal.proposedAt > props.getProposalTtlSeconds()) {
                log.warn("Proposal for batch {} expired with {}/{} attestations",
                        proposal.settlement.batchId(), proposal.attestations.size(), minAttestations());
                it.remove();
                dropped++;
            }
        }
        return dropped;
    }

    /** Forgets a proposal once its settlement is on the ledger. */
    public synchronized void complete(String hash) {
        proposals.remove(hash);
    }

    private boolean isValid(String batchId, String hash, CommitteeSignature sig) {
        Optional<String> signer = EthSignatures.recoverSigner(hash, sig.signature());
        if (signer.isEmpty() || !EthSignatures.sameAddress(signer.get(), sig.operator())) {
            log.warn("Signature for batch {} does not recover to {}", batchId, sig.operator());
            return false;
        }
        if (!intentStore.isCommitteeMemberSelected(batchId, sig.operator())) {
            log.warn("Operator {} is not selected for batch {}", sig.operator(), batchId);
            return false;
        }
        return true;
    }

    private void evictOldestOverCapacity() {
        Iterator<Proposal> it = proposals.values().iterator();
        while (proposals.size() >= Math.max(1, props.getMaxPendingProposals()) && it.hasNext()) {
            Proposal oldest = it.next();
            log.warn("Pending proposals at capacity, dropping batch {}", oldest.settlement.batchId());
            it.remove();
        }
    }

    private QuorumStatus statusOf(Proposal proposal) {
        int count = proposal.attestations.size();
        return new QuorumStatus(proposal.settlement.batchId(), proposal.hash, count, minAttestations(),
                count >= minAttestations());
    }

    private static String key(String address) {
        return address.toLowerCase(Locale.ROOT);
    }

    private static final class Proposal {
        private final String hash;
        private final Settlement settlement;
        private final long proposedAt;  // unix seconds
        // key: lower-case operator address
        private final Map<String, CommitteeSignature> attestations = new LinkedHashMap<>();

        private Proposal(String hash, Settlement settlement, long proposedAt) {
            this.hash = hash;
            this.settlement = settlement;
            this.proposedAt = proposedAt;
        }
    }
}
