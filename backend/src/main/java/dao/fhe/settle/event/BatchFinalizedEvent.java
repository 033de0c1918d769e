package dao.fhe.settle.event;

public record BatchFinalizedEvent(String batchId, int intentCount, long blockNumber) {}
