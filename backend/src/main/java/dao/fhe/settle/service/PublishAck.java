package dao.fhe.settle.service;

public record PublishAck(String batchId, Status status, String txHash) {

    public enum Status {
        /** Settlement transaction accepted by the ledger. */
        SUBMITTED,
        /** Ledger already shows the batch as settled. */
        ALREADY_SETTLED,
        /** This engine already attempted the batch; nothing sent. */
        ALREADY_ATTEMPTED
    }

    public static PublishAck submitted(String batchId, String txHash) {
        return new PublishAck(batchId, Status.SUBMITTED, txHash);
    }

    public static PublishAck alreadySettled(String batchId) {
        return new PublishAck(batchId, Status.ALREADY_SETTLED, null);
    }

    public static PublishAck alreadyAttempted(String batchId) {
        return new PublishAck(batchId, Status.ALREADY_ATTEMPTED, null);
    }
}
