package dao.fhe.settle.cipher;

import dao.fhe.settle.exception.DecryptionUnavailableException;
import dao.fhe.settle.model.EncryptedValue;
import dao.fhe.settle.model.TypeTag;
import dao.fhe.settle.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process stand-in for the threshold network on local chains: handles are opaque
 * keccak digests and the plaintext table lives in memory.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "cipher", name = "mode", havingValue = "mock", matchIfMissing = true)
public class MockThresholdCipherService implements ThresholdCipherService {

    private final Map<BigInteger, BigInteger> plaintexts = new ConcurrentHashMap<>();
    private final AtomicLong nonce = new AtomicLong();

    public MockThresholdCipherService() {
        log.info("Threshold cipher running in MOCK mode (plaintexts kept in memory)");
    }

    @Override
    public BigInteger decrypt(EncryptedValue value) {
        BigInteger plaintext = plaintexts.get(value.handle());
        if (plaintext == null) {
            throw new DecryptionUnavailableException("No decryption permission for handle " + value.handleHex());
        }
        return plaintext;
    }

    @Override
    public EncryptedValue encrypt(BigInteger cleartext, TypeTag tag) {
        if (cleartext == null || cleartext.signum() < 0) {
            throw new IllegalArgumentException("Cleartext must be non-negative");
        }
        String digest = HexUtil.keccakOf("mock-ct", tag.code(), cleartext, nonce.incrementAndGet());
        BigInteger handle = Numeric.toBigInt(digest);
        plaintexts.put(handle, cleartext);
        return new EncryptedValue(handle, tag, 0, "0x");
    }

    /** Registers a raw plaintext for an externally chosen handle. */
    public EncryptedValue register(BigInteger handle, BigInteger cleartext, TypeTag tag) {
        plaintexts.put(handle, cleartext);
        return EncryptedValue.of(handle, tag);
    }
}
