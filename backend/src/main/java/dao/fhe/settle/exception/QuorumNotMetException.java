package dao.fhe.settle.exception;

import lombok.Getter;

@Getter
public class QuorumNotMetException extends SettlementEngineException {

    private final String batchId;
    private final int validSignatures;
    private final int required;

    public QuorumNotMetException(String batchId, int validSignatures, int required) {
        super("Quorum not met for batch " + batchId + ": " + validSignatures + "/" + required + " valid signatures");
        this.batchId = batchId;
        this.validSignatures = validSignatures;
        this.required = required;
    }
}
