package dao.fhe.settle.ledger;

public record SettlementReceipt(String batchId, String txHash, long blockNumber) {}
