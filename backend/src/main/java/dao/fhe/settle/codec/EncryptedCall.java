package dao.fhe.settle.codec;

import dao.fhe.settle.model.EncryptedValue;

import java.util.List;

/**
 * Universal encrypted intent: every part of the call, including where it goes and
 * which function it invokes, is a ciphertext.
 */
public record EncryptedCall(
        EncryptedValue decoder,
        EncryptedValue target,
        EncryptedValue selector,
        List<EncryptedValue> args
) {

    public EncryptedCall {
        args = List.copyOf(args);
    }
}
