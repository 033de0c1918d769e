package dao.fhe.settle.service;

import dao.fhe.settle.model.InternalizedTransfer;
import dao.fhe.settle.model.NetSwap;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * @param consumed amount of each intent filled internally, keyed by intent id
 */
public record MatchResult(List<InternalizedTransfer> transfers, List<NetSwap> netSwaps, Map<String, BigInteger> consumed) {

    public MatchResult {
        transfers = List.copyOf(transfers);
        netSwaps = List.copyOf(netSwaps);
        consumed = Map.copyOf(consumed);
    }

    public BigInteger consumedOf(String intentId) {
        return consumed.getOrDefault(intentId, BigInteger.ZERO);
    }
}
