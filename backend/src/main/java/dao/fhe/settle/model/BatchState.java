package dao.fhe.settle.model;

public enum BatchState {
    OPEN,
    FINALIZED,
    SETTLED;

    /** Transitions are strictly forward and one step at a time. */
    public boolean canAdvanceTo(BatchState next) {
        return next.ordinal() == ordinal() + 1;
    }
}
