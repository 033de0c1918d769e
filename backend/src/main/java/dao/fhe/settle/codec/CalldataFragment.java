package dao.fhe.settle.codec;

/**
 * One ABI head word.
 *
 * @param solidityType canonical Solidity type name, e.g. "uint128"
 * @param word         64 lower-case hex chars, no prefix
 */
public record CalldataFragment(String solidityType, String word) {}
