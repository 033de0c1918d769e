package dao.fhe.settle.codec;

import dao.fhe.settle.cipher.ThresholdCipherService;
import dao.fhe.settle.codec.NativeValue.AddressValue;
import dao.fhe.settle.codec.NativeValue.BoolValue;
import dao.fhe.settle.codec.NativeValue.UintValue;
import dao.fhe.settle.exception.TypeMismatchException;
import dao.fhe.settle.exception.UnsupportedTagException;
import dao.fhe.settle.model.EncryptedValue;
import dao.fhe.settle.model.TypeTag;
import dao.fhe.settle.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint128;
import org.web3j.abi.datatypes.generated.Uint16;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts between tagged ciphertext handles, native plaintext values and ABI words.
 * Every operation refuses {@link TypeTag#UINT256}.
 */
@Slf4j
@Component
public class EncryptedValueCodec {

    private static final int WORD_HEX_LENGTH = 64;

    private final ThresholdCipherService cipherService;

    public EncryptedValueCodec(ThresholdCipherService cipherService) {
        this.cipherService = cipherService;
    }

    /**
     * Decrypts {@code value} and interprets the cleartext as {@code expected}.
     *
     * @throws TypeMismatchException           handle tagged differently, or cleartext out of range
     * @throws UnsupportedTagException         either tag is the rejected UINT256
     * @throws dao.fhe.settle.exception.DecryptionUnavailableException threshold service failure
     */
    public NativeValue decode(EncryptedValue value, TypeTag expected) {
        requireSupported(expected);
        requireSupported(value.tag());
        if (value.tag() != expected) {
            throw new TypeMismatchException(expected, value.tag(), "handle " + value.handleHex());
        }
        BigInteger raw = cipherService.decrypt(value);
        return interpret(raw, expected);
    }

    public NativeValue interpret(BigInteger raw, TypeTag tag) {
        if (raw == null || raw.signum() < 0) {
            throw new TypeMismatchException("Cleartext must be a non-negative integer, got " + raw);
        }
        return switch (tag) {
            case BOOL -> {
                if (raw.compareTo(BigInteger.ONE) > 0) {
                    throw new TypeMismatchException("Cleartext " + raw + " is not a bool");
                }
                yield new BoolValue(raw.signum() == 1);
            }
            case UINT8, UINT16, UINT32, UINT64, UINT128 -> new UintValue(tag, requireWidth(raw, tag));
            case ADDRESS -> new AddressValue(Numeric.toHexStringWithPrefixZeroPadded(requireWidth(raw, tag), 40));
            case UINT256 -> throw new UnsupportedTagException(tag);
        };
    }

    public CalldataFragment encode(NativeValue value, TypeTag tag) {
        requireSupported(tag);
        if (value.tag() != tag) {
            throw new TypeMismatchException(tag, value.tag(), "encode");
        }
        Type<?> abiValue = switch (tag) {
            case BOOL -> new Bool(((BoolValue) value).value());
            case UINT8 -> new Uint8(requireWidth(uint(value), tag));
            case UINT16 -> new Uint16(requireWidth(uint(value), tag));
            case UINT32 -> new Uint32(requireWidth(uint(value), tag));
            case UINT64 -> new Uint64(requireWidth(uint(value), tag));
            case UINT128 -> new Uint128(requireWidth(uint(value), tag));
            case ADDRESS -> new Address(((AddressValue) value).value());
            case UINT256 -> throw new UnsupportedTagException(tag);
        };
        return new CalldataFragment(tag.solidityType(), TypeEncoder.encode(abiValue));
    }

    public NativeValue decode(CalldataFragment fragment, TypeTag tag) {
        requireSupported(tag);
        if (!tag.solidityType().equals(fragment.solidityType())) {
            throw new TypeMismatchException("Fragment of type " + fragment.solidityType() + " read as " + tag);
        }
        String word = fragment.word();
        if (word == null || word.length() != WORD_HEX_LENGTH || !HexUtil.isHex(word)) {
            throw new TypeMismatchException("Malformed ABI word: " + word);
        }
        return interpret(new BigInteger(word, 16), tag);
    }

    /**
     * Decrypts every part of a universal encrypted intent and rebuilds the calldata the
     * decoder contract would forward to the target.
     */
    public DecodedCall decodeCall(EncryptedCall call) {
        String decoder = ((AddressValue) decode(call.decoder(), TypeTag.ADDRESS)).value();
        String target = ((AddressValue) decode(call.target(), TypeTag.ADDRESS)).value();
        BigInteger selectorValue = ((UintValue) decode(call.selector(), TypeTag.UINT32)).value();
        String selector = Numeric.toHexStringWithPrefixZeroPadded(selectorValue, 8);

        List<NativeValue> args = new ArrayList<>();
        StringBuilder calldata = new StringBuilder(selector);
        for (EncryptedValue arg : call.args()) {
            NativeValue decoded = decode(arg, arg.tag());
            args.add(decoded);
            calldata.append(encode(decoded, arg.tag()).word());
        }
        log.debug("Decoded encrypted call: target={}, selector={}, args={}", target, selector, args.size());
        return new DecodedCall(decoder, target, selector, args, calldata.toString());
    }

    private static void requireSupported(TypeTag tag) {
        if (tag.isRejected()) {
            throw new UnsupportedTagException(tag);
        }
    }

    private static BigInteger uint(NativeValue value) {
        return ((UintValue) value).value();
    }

    private static BigInteger requireWidth(BigInteger raw, TypeTag tag) {
        if (raw.signum() < 0 || raw.bitLength() > tag.bitWidth()) {
            throw new TypeMismatchException("Value " + raw + " does not fit " + tag.solidityType());
        }
        return raw;
    }
}
