package dao.fhe.settle.codec;

import java.util.List;

/**
 * @param calldata 0x-prefixed selector followed by one 32-byte word per argument
 */
public record DecodedCall(String decoder, String target, String selector, List<NativeValue> args, String calldata) {

    public DecodedCall {
        args = List.copyOf(args);
    }
}
