package dao.fhe.settle.service;

import dao.fhe.settle.model.CommitteeSignature;
import dao.fhe.settle.util.EthSignatures;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;

import java.security.GeneralSecurityException;

/**
 * This engine's committee identity: the operator key used for attestations and, with the
 * rpc ledger, for sending transactions.
 */
@Slf4j
public class OperatorIdentity {

    private final Credentials credentials;

    public OperatorIdentity(ECKeyPair keyPair) {
        this.credentials = Credentials.create(keyPair);
    }

    public static OperatorIdentity fromPrivateKey(String privateKeyHex) {
        if (privateKeyHex == null || privateKeyHex.isBlank()) {
            OperatorIdentity ephemeral = new OperatorIdentity(generateKeyPair());
            log.warn("No operator private key configured. Using ephemeral operator {} (local development only).",
                    ephemeral.address());
            return ephemeral;
        }
        OperatorIdentity identity = new OperatorIdentity(Credentials.create(privateKeyHex.trim()).getEcKeyPair());
        log.info("Operator identity: {}", identity.address());
        return identity;
    }

    public static ECKeyPair generateKeyPair() {
        try {
            return Keys.createEcKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to generate operator key: " + e.getMessage(), e);
        }
    }

    /** Checksummed operator address. */
    public String address() {
        return Keys.toChecksumAddress(credentials.getAddress());
    }

    public Credentials credentials() {
        return credentials;
    }

    public CommitteeSignature sign(String digestHex) {
        return new CommitteeSignature(address(), EthSignatures.signPrefixed(digestHex, credentials.getEcKeyPair()));
    }
}
