package dao.fhe.settle.service;

import dao.fhe.settle.model.Settlement;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

/** keccak256 of the canonical ABI encoding; the digest committee members sign. */
@Component
public class SettlementHasher {

    public String hash(Settlement settlement) {
        String encoded = SettlementAbi.canonicalEncoding(settlement);
        return Numeric.toHexString(Hash.sha3(Numeric.hexStringToByteArray(encoded)));
    }
}
