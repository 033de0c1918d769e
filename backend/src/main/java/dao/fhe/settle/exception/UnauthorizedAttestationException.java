package dao.fhe.settle.exception;

/** Attestation from an operator that is not selected, or whose signature does not recover to it. */
public class UnauthorizedAttestationException extends SettlementEngineException {

    public UnauthorizedAttestationException(String message) {
        super(message);
    }
}
