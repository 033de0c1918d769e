package dao.fhe.settle.model;

import java.util.List;

public record Settlement(
        String batchId,
        List<InternalizedTransfer> internalizedTransfers,
        List<NetSwap> netSwaps,
        List<CommitteeSignature> signatures
) {

    public Settlement {
        internalizedTransfers = List.copyOf(internalizedTransfers);
        netSwaps = List.copyOf(netSwaps);
        signatures = signatures == null ? List.of() : List.copyOf(signatures);
    }

    public Settlement withSignatures(List<CommitteeSignature> newSignatures) {
        return new Settlement(batchId, internalizedTransfers, netSwaps, newSignatures);
    }
}
