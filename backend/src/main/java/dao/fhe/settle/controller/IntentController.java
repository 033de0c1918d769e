package dao.fhe.settle.controller;

import dao.fhe.settle.ledger.IntentStore;
import dao.fhe.settle.ledger.IntentSubmission;
import dao.fhe.settle.model.EncryptedValue;
import dao.fhe.settle.model.IntentSubmissionRequest;
import dao.fhe.settle.model.TypeTag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.web3j.utils.Numeric;

import java.util.Map;

@RestController
@RequestMapping("/api/intents")
public class IntentController {

    private final IntentStore intentStore;

    public IntentController(IntentStore intentStore) {
        this.intentStore = intentStore;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> submitIntent(@Valid @RequestBody IntentSubmissionRequest req) {
        EncryptedValue amount = new EncryptedValue(
                Numeric.toBigInt(req.getCtHash()),
                TypeTag.fromCode(req.getUtype()),
                req.getSecurityZone(),
                req.getProof());
        String intentId = intentStore.submitIntent(new IntentSubmission(
                req.getPoolId(), req.getSubmitter(), req.getTokenIn(), req.getTokenOut(), amount, req.getDeadline()));
        return ResponseEntity.accepted().body(Map.of("intentId", intentId));
    }
}
