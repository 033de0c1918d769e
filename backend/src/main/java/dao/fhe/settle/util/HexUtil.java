package dao.fhe.settle.util;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * Hex and hashing helpers shared by the ledger adapters and the codec.
 */
public final class HexUtil {
    private HexUtil() {}

    private static final SecureRandom RNG = new SecureRandom();

    public static byte[] randomBytes32() {
        byte[] salt = new byte[32];
        RNG.nextBytes(salt);
        return salt;
    }

    public static String toHex0x(byte[] bytes) {
        return Numeric.toHexString(bytes);
    }

    /** 0x-prefixed, lower-case, left-padded to 32 bytes. */
    public static String toBytes32Hex(BigInteger value) {
        return Numeric.toHexStringWithPrefixZeroPadded(value, 64);
    }

    public static byte[] bytes32(String hex) {
        byte[] bytes = Numeric.hexStringToByteArray(hex);
        if (bytes.length != 32) {
            throw new IllegalArgumentException("Expected 32 bytes, got " + bytes.length + " for " + hex);
        }
        return bytes;
    }

    /** Canonical form for bytes32 ids: 0x + 64 lower-case hex chars. */
    public static String normalizeBytes32(String hex) {
        return toHex0x(bytes32(hex));
    }

    /** keccak256 over the UTF-8 joining of the parts with ':'. */
    public static String keccakOf(Object... parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(':');
            sb.append(parts[i]);
        }
        return toHex0x(Hash.sha3(sb.toString().getBytes(StandardCharsets.UTF_8)));
    }

    public static boolean isHex(String s) {
        String clean = Numeric.cleanHexPrefix(s);
        for (int i = 0; i < clean.length(); i++) {
            if (Character.digit(clean.charAt(i), 16) < 0) return false;
        }
        return true;
    }
}
