package dao.fhe.settle.exception;

/** The ledger refused a state-changing call (revert, invalid signatures, state conflict). */
public class LedgerRejectedException extends SettlementEngineException {

    public LedgerRejectedException(String message) {
        super(message);
    }

    public LedgerRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
