package dao.fhe.settle.service;

import dao.fhe.settle.config.ConsensusProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Pushes this operator's attestations to the configured peers. Delivery is best effort:
 * undelivered attestations are announced again on the next poll tick.
 */
@Slf4j
@Component
public class PeerAttestationAnnouncer {

    static final String ATTESTATIONS_PATH = "/api/consensus/attestations";

    private final RestTemplate restTemplate;
    private final ConsensusProperties props;

    public PeerAttestationAnnouncer(RestTemplate restTemplate, ConsensusProperties props) {
        this.restTemplate = restTemplate;
        this.props = props;
    }

    /** @return number of peers that accepted the attestation */
    public int announce(AttestationMessage message) {
        int delivered = 0;
        for (String peer : props.getPeers()) {
            String url = trimSlash(peer) + ATTESTATIONS_PATH;
            try {
                restTemplate.postForEntity(url, message, Void.class);
                delivered++;
            } catch (RestClientException e) {
                log.warn("Attestation for batch {} not delivered to {}: {}", message.batchId(), peer, e.getMessage());
            }
        }
        if (!props.getPeers().isEmpty()) {
            log.debug("Attestation for batch {} delivered to {}/{} peers", message.batchId(), delivered, props.getPeers().size());
        }
        return delivered;
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
