package dao.fhe.settle.exception;

public class NetworkTransientException extends SettlementEngineException {

    public NetworkTransientException(String message) {
        super(message);
    }

    public NetworkTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
