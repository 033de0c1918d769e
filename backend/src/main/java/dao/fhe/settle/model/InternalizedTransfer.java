package dao.fhe.settle.model;

import java.math.BigInteger;

/**
 * Trade settled directly between two intents of the same batch. Side A is the resting
 * (earlier) intent, side B the incoming one.
 */
public record InternalizedTransfer(
        String intentIdA,
        String intentIdB,
        String userA,
        String userB,
        String tokenA,
        String tokenB,
        BigInteger amountA,
        BigInteger amountB
) {}
