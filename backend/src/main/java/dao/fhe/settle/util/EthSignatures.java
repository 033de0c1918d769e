package dao.fhe.settle.util;

import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Optional;

/**
 * EIP-191 ("personal_sign") signatures over 32-byte digests, encoded as r || s || v.
 */
public final class EthSignatures {
    private EthSignatures() {}

    public static String signPrefixed(String digestHex, ECKeyPair keyPair) {
        Sign.SignatureData sig = Sign.signPrefixedMessage(HexUtil.bytes32(digestHex), keyPair);
        byte[] out = new byte[65];
        System.arraycopy(sig.getR(), 0, out, 0, 32);
        System.arraycopy(sig.getS(), 0, out, 32, 32);
        out[64] = sig.getV()[0];
        return Numeric.toHexString(out);
    }

    /**
     * Recovers the checksummed signer address, or empty when the signature is malformed
     * or does not recover to any key.
     */
    public static Optional<String> recoverSigner(String digestHex, String signatureHex) {
        if (signatureHex == null || !HexUtil.isHex(signatureHex)) {
            return Optional.empty();
        }
        byte[] raw = Numeric.hexStringToByteArray(signatureHex);
        if (raw.length != 65) {
            return Optional.empty();
        }
        byte v = raw[64];
        if (v < 27) {
            v += 27;
        }
        Sign.SignatureData sig = new Sign.SignatureData(
                v, Arrays.copyOfRange(raw, 0, 32), Arrays.copyOfRange(raw, 32, 64));
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(HexUtil.bytes32(digestHex), sig);
            return Optional.of(Keys.toChecksumAddress(Keys.getAddress(publicKey)));
        } catch (SignatureException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static boolean sameAddress(String a, String b) {
        return a != null && b != null && Numeric.cleanHexPrefix(a).equalsIgnoreCase(Numeric.cleanHexPrefix(b));
    }
}
