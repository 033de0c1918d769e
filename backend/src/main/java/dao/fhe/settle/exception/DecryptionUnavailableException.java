package dao.fhe.settle.exception;

/** Threshold decryption service unreachable or permission not granted yet. */
public class DecryptionUnavailableException extends SettlementEngineException {

    public DecryptionUnavailableException(String message) {
        super(message);
    }

    public DecryptionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
