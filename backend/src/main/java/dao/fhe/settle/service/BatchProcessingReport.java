package dao.fhe.settle.service;

import java.util.List;

public record BatchProcessingReport(
        String batchId,
        Outcome outcome,
        String settlementHash,
        int matchedIntents,
        int transfers,
        int netSwaps,
        List<Exclusion> excluded,
        PublishAck publishAck,
        long processedAt
) {

    public BatchProcessingReport {
        excluded = excluded == null ? List.of() : List.copyOf(excluded);
    }

    public enum Outcome {
        PUBLISHED,
        PENDING_QUORUM,
        /** Ledger rejected the settlement twice; retried from the pending loop. */
        PENDING_LEDGER,
        ALREADY_SETTLED,
        NOT_FINALIZED
    }

    public record Exclusion(String intentId, String reason) {}

    static BatchProcessingReport skipped(String batchId, Outcome outcome, long now) {
        return new BatchProcessingReport(batchId, outcome, null, 0, 0, 0, List.of(), null, now);
    }
}
