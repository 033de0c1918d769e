package dao.fhe.settle.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Residual of one directed pair that could not be internalized and has to be executed
 * against an external venue.
 */
public record NetSwap(String tokenIn, String tokenOut, BigInteger netAmount, List<String> remainingIntentIds) {

    public NetSwap {
        remainingIntentIds = List.copyOf(remainingIntentIds);
    }
}
