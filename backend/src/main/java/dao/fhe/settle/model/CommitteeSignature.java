package dao.fhe.settle.model;

/**
 * @param operator  committee member address
 * @param signature 65-byte EIP-191 signature over the settlement hash, hex encoded (r || s || v)
 */
public record CommitteeSignature(String operator, String signature) {}
