package dao.fhe.settle.codec;

import dao.fhe.settle.exception.TypeMismatchException;
import dao.fhe.settle.model.TypeTag;
import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Decrypted plaintext with the native type it was encrypted as.
 */
public sealed interface NativeValue permits NativeValue.BoolValue, NativeValue.UintValue, NativeValue.AddressValue {

    TypeTag tag();

    record BoolValue(boolean value) implements NativeValue {
        @Override
        public TypeTag tag() {
            return TypeTag.BOOL;
        }
    }

    record UintValue(TypeTag tag, BigInteger value) implements NativeValue {
        public UintValue {
            Objects.requireNonNull(tag, "tag");
            Objects.requireNonNull(value, "value");
            if (tag == TypeTag.BOOL || tag == TypeTag.ADDRESS) {
                throw new TypeMismatchException("UintValue cannot carry tag " + tag);
            }
        }
    }

    /** EIP-55 checksummed address. Construction normalizes any casing. */
    record AddressValue(String value) implements NativeValue {
        public AddressValue {
            Objects.requireNonNull(value, "value");
            String clean = Numeric.cleanHexPrefix(value);
            if (clean.length() != 40) {
                throw new TypeMismatchException("Address must be 20 bytes: " + value);
            }
            value = Keys.toChecksumAddress(clean);
        }

        @Override
        public TypeTag tag() {
            return TypeTag.ADDRESS;
        }
    }

    static NativeValue uint(TypeTag tag, long value) {
        return new UintValue(tag, BigInteger.valueOf(value));
    }
}
