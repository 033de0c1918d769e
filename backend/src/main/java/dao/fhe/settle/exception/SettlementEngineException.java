package dao.fhe.settle.exception;

/**
 * Root of the engine's error taxonomy. Subclasses are grouped by how the caller recovers:
 * intent-level errors exclude one intent, batch-level errors keep a batch pending, transient
 * errors are retried with backoff.
 */
public abstract class SettlementEngineException extends RuntimeException {

    protected SettlementEngineException(String message) {
        super(message);
    }

    protected SettlementEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
