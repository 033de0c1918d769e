package dao.fhe.settle.service;

public record QuorumStatus(String batchId, String settlementHash, int attestations, int required, boolean reached) {}
