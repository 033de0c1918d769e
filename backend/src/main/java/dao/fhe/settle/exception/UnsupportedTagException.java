package dao.fhe.settle.exception;

import dao.fhe.settle.model.TypeTag;

/** Unknown wire code or a deprecated tag. Intent-level. */
public class UnsupportedTagException extends SettlementEngineException {

    public UnsupportedTagException(String message) {
        super(message);
    }

    public UnsupportedTagException(TypeTag tag) {
        super("Type tag " + tag + " (code " + tag.code() + ") is not supported");
    }
}
