package dao.fhe.settle.ledger;

import dao.fhe.settle.model.EncryptedValue;

public record IntentSubmission(
        String poolId,
        String submitter,
        String tokenIn,
        String tokenOut,
        EncryptedValue encryptedAmount,
        long deadline
) {}
