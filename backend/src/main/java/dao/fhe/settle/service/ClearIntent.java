package dao.fhe.settle.service;

import java.math.BigInteger;

/** Intent with its amount decrypted, as fed to the matcher. */
public record ClearIntent(String intentId, String submitter, String tokenIn, String tokenOut, BigInteger amount) {}
