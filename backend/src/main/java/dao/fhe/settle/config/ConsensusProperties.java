package dao.fhe.settle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "consensus")
public class ConsensusProperties {

    /** Distinct valid committee signatures required before publishing. */
    private int minAttestations = 1;

    /** Committee addresses for the local ledger. Empty means the operator alone. */
    private List<String> committee = new ArrayList<>();

    /** Base URLs of peer engines receiving our attestations. */
    private List<String> peers = new ArrayList<>();

    /**
     * Proposals still below quorum after this long are dropped
     * Default: 3600 seconds
     */
    private long proposalTtlSeconds = 3600;

    /** Upper bound on proposals held in memory; the oldest is dropped first. */
    private int maxPendingProposals = 1024;
}
