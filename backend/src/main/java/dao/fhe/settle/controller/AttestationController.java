package dao.fhe.settle.controller;

import dao.fhe.settle.service.AttestationMessage;
import dao.fhe.settle.service.ConsensusAggregator;
import dao.fhe.settle.service.QuorumStatus;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Receives attestations pushed by peer committee members.
 */
@Slf4j
@RestController
@RequestMapping("/api/consensus")
public class AttestationController {

    private final ConsensusAggregator consensusAggregator;

    public AttestationController(ConsensusAggregator consensusAggregator) {
        this.consensusAggregator = consensusAggregator;
    }

    @PostMapping("/attestations")
    public ResponseEntity<QuorumStatus> receiveAttestation(@Valid @RequestBody AttestationMessage message) {
        log.debug("Attestation from {} for batch {}", message.operator(), message.batchId());
        QuorumStatus status = consensusAggregator.attest(message.settlementHash(), message.operator(), message.signature());
        return ResponseEntity.ok(status);
    }

    @GetMapping("/pending")
    public ResponseEntity<Map<String, Object>> pending() {
        List<QuorumStatus> pending = consensusAggregator.pending();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("minAttestations", consensusAggregator.minAttestations());
        response.put("pending", pending);
        return ResponseEntity.ok(response);
    }
}
