package dao.fhe.settle.exception;

import dao.fhe.settle.model.TypeTag;

/** Value tagged or shaped differently than the caller expected. Intent-level. */
public class TypeMismatchException extends SettlementEngineException {

    public TypeMismatchException(String message) {
        super(message);
    }

    public TypeMismatchException(TypeTag expected, TypeTag actual, String context) {
        super("Type mismatch (" + context + "): expected " + expected + " but got " + actual);
    }
}
