package dao.fhe.settle.ledger;

import dao.fhe.settle.model.CommitteeSignature;
import dao.fhe.settle.model.NetSwap;

import java.util.List;

public record PublishedSettlement(
        String batchId,
        String settlementHash,
        List<PublishedTransfer> transfers,
        List<NetSwap> netSwaps,
        List<CommitteeSignature> signatures
) {

    public PublishedSettlement {
        transfers = List.copyOf(transfers);
        netSwaps = List.copyOf(netSwaps);
        signatures = List.copyOf(signatures);
    }
}
