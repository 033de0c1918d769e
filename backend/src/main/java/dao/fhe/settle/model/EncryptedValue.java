package dao.fhe.settle.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Tagged ciphertext handle as emitted by the encryption side.
 *
 * @param handle       ciphertext hash, resolvable through the threshold decryption service
 * @param tag          native type of the plaintext behind the handle
 * @param securityZone FHE security zone the handle was created in
 * @param proof        hex-encoded input proof / signature ("0x" when absent)
 */
public record EncryptedValue(BigInteger handle, TypeTag tag, int securityZone, String proof) {

    public EncryptedValue {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(tag, "tag");
        if (handle.signum() < 0) {
            throw new IllegalArgumentException("handle must be unsigned");
        }
        proof = proof == null || proof.isBlank() ? "0x" : proof;
    }

    public static EncryptedValue of(BigInteger handle, TypeTag tag) {
        return new EncryptedValue(handle, tag, 0, "0x");
    }

    public String handleHex() {
        return "0x" + handle.toString(16);
    }
}
