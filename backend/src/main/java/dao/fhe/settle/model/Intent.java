package dao.fhe.settle.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Intent {

    /** Amounts are always encrypted as uint128. */
    public static final TypeTag AMOUNT_TAG = TypeTag.UINT128;

    String id;
    String submitter;
    String tokenIn;
    String tokenOut;
    EncryptedValue encryptedAmount;
    String poolId;
    long submittedAt;     // unix seconds
    long submittedBlock;
    long deadline;        // unix seconds

    public boolean isExpiredAt(long unixSeconds) {
        return unixSeconds > deadline;
    }
}
