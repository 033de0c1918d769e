package dao.fhe.settle.ledger;

import dao.fhe.settle.model.EncryptedValue;

/** Internalized transfer as written to the ledger, amounts re-encrypted. */
public record PublishedTransfer(
        String intentIdA,
        String intentIdB,
        String userA,
        String userB,
        String tokenA,
        String tokenB,
        EncryptedValue amountA,
        EncryptedValue amountB
) {}
