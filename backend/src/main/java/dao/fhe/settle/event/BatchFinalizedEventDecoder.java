package dao.fhe.settle.event;

import dao.fhe.settle.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Decodes {@code BatchFinalized} logs of the intent hook contract.
 * <p>
 * Current contracts index the batch id:
 * {@code event BatchFinalized(bytes32 indexed batchId, uint256 intentCount)}.
 * Logs with only topic0 carry both fields in data.
 */
@Slf4j
@Component
public class BatchFinalizedEventDecoder {

    public static final String EVENT_SIGNATURE = "BatchFinalized(bytes32,uint256)";

    // topic0 = keccak256(eventSignature)
    public static final String TOPIC0 = Hash.sha3String(EVENT_SIGNATURE).toLowerCase(Locale.ROOT);

    private static final int WORD = 64;

    public LogDecodeResult<BatchFinalizedEvent> decode(List<String> topics, String dataHex, long blockNumber) {
        if (topics == null || topics.isEmpty() || !TOPIC0.equalsIgnoreCase(normalizeHex32(topics.get(0)))) {
            return new LogDecodeResult.NotThisType<>();
        }
        String data = Numeric.cleanHexPrefix(dataHex == null ? "" : dataHex);
        if (!HexUtil.isHex(data)) {
            return new LogDecodeResult.Malformed<>("data is not hex");
        }

        if (topics.size() >= 2) {
            if (data.length() != WORD) {
                return new LogDecodeResult.Malformed<>("expected 1 data word, got " + data.length() / 2 + " bytes");
            }
            String batchId = normalizeHex32(topics.get(1));
            List<Type<?>> decoded = decodeWeb3Abi(data, new TypeReference<Uint256>() {});
            return toEvent(batchId, ((Uint256) decoded.get(0)).getValue(), blockNumber);
        }

        if (data.length() != 2 * WORD) {
            return new LogDecodeResult.Malformed<>("expected 2 data words, got " + data.length() / 2 + " bytes");
        }
        List<Type<?>> decoded = decodeWeb3Abi(data, new TypeReference<Bytes32>() {}, new TypeReference<Uint256>() {});
        String batchId = Numeric.toHexString(((Bytes32) decoded.get(0)).getValue());
        return toEvent(batchId, ((Uint256) decoded.get(1)).getValue(), blockNumber);
    }

    private static LogDecodeResult<BatchFinalizedEvent> toEvent(String batchId, BigInteger intentCount, long blockNumber) {
        if (intentCount.bitLength() > 31) {
            return new LogDecodeResult.Malformed<>("intentCount out of range: " + intentCount);
        }
        return new LogDecodeResult.Matched<>(new BatchFinalizedEvent(batchId, intentCount.intValue(), blockNumber));
    }

    /** Fixed 32-byte width: least-significant bytes kept, left-padded with zeros. */
    static String normalizeHex32(String hex) {
        String c = Numeric.cleanHexPrefix(hex == null ? "" : hex).toLowerCase(Locale.ROOT);
        if (c.length() < WORD) {
            c = "0".repeat(WORD - c.length()) + c;
        } else if (c.length() > WORD) {
            c = c.substring(c.length() - WORD);
        }
        return "0x" + c;
    }

    private static List<Type<?>> decodeWeb3Abi(String dataHex, TypeReference<?>... outputs) {
        @SuppressWarnings({"rawtypes", "unchecked"})
        List<TypeReference<Type>> typed = (List) Arrays.asList(outputs);

        @SuppressWarnings({"rawtypes", "unchecked"})
        List<Type<?>> decoded = (List) FunctionReturnDecoder.decode("0x" + dataHex, typed);
        return decoded;
    }
}
