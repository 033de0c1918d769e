package dao.fhe.settle.exception;

/** Forced or administrative finalization requested by a caller outside batch.privileged-finalizers. */
public class UnauthorizedFinalizerException extends SettlementEngineException {

    public UnauthorizedFinalizerException(String caller) {
        super("Caller " + caller + " is not a privileged finalizer");
    }
}
