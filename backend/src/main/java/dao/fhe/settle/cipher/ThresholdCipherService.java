package dao.fhe.settle.cipher;

import dao.fhe.settle.model.EncryptedValue;
import dao.fhe.settle.model.TypeTag;

import java.math.BigInteger;

/**
 * Threshold decryption network as seen by one committee member.
 */
public interface ThresholdCipherService {

    /**
     * Raw cleartext behind the handle. Interpretation according to the tag is the codec's job.
     *
     * @throws dao.fhe.settle.exception.DecryptionUnavailableException service unreachable or
     *         decryption permission not granted to this operator
     */
    BigInteger decrypt(EncryptedValue value);

    /** Encrypts {@code cleartext} as {@code tag}, returning a handle the ledger accepts. */
    EncryptedValue encrypt(BigInteger cleartext, TypeTag tag);
}
