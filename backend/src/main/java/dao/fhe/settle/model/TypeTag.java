package dao.fhe.settle.model;

import dao.fhe.settle.exception.UnsupportedTagException;

/**
 * Discriminant of an encrypted value. The numeric codes are the FHE platform's wire codes
 * ({@code utype} in the on-chain structs); code 1 (uint4) was never issued to this system.
 */
public enum TypeTag {

    BOOL(0, "bool", 1),
    UINT8(2, "uint8", 8),
    UINT16(3, "uint16", 16),
    UINT32(4, "uint32", 32),
    UINT64(5, "uint64", 64),
    UINT128(6, "uint128", 128),
    ADDRESS(7, "address", 160),
    /**
     * Legacy 256-bit ciphertexts. Recognised on the wire so it can be rejected by name;
     * every codec operation on it fails with {@link UnsupportedTagException}.
     */
    UINT256(8, "uint256", 256);

    private final int code;
    private final String solidityType;
    private final int bitWidth;

    TypeTag(int code, String solidityType, int bitWidth) {
        this.code = code;
        this.solidityType = solidityType;
        this.bitWidth = bitWidth;
    }

    public int code() {
        return code;
    }

    public String solidityType() {
        return solidityType;
    }

    public int bitWidth() {
        return bitWidth;
    }

    public boolean isRejected() {
        return this == UINT256;
    }

    public static TypeTag fromCode(int code) {
        for (TypeTag tag : values()) {
            if (tag.code == code) {
                return tag;
            }
        }
        throw new UnsupportedTagException("Unknown type tag code: " + code);
    }
}
