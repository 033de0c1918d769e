package dao.fhe.settle.service;

import dao.fhe.settle.model.InternalizedTransfer;
import dao.fhe.settle.model.NetSwap;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per token: matched amounts given plus net swap amounts sold must equal the original
 * amounts of the intents selling that token.
 */
public final class ConservationCheck {
    private ConservationCheck() {}

    public static void verify(List<ClearIntent> intents, MatchResult result) {
        Map<String, BigInteger> sold = new HashMap<>();
        for (ClearIntent intent : intents) {
            if (intent.amount().signum() > 0) {
                add(sold, intent.tokenIn(), intent.amount());
            }
        }

        Map<String, BigInteger> accounted = new HashMap<>();
        for (InternalizedTransfer t : result.transfers()) {
            add(accounted, t.tokenA(), t.amountA());
            add(accounted, t.tokenB(), t.amountB());
        }
        for (NetSwap swap : result.netSwaps()) {
            add(accounted, swap.tokenIn(), swap.netAmount());
        }

        if (!sold.equals(accounted)) {
            throw new IllegalStateException("Conservation violated: sold=" + sold + ", accounted=" + accounted);
        }
    }

    private static void add(Map<String, BigInteger> totals, String token, BigInteger amount) {
        totals.merge(token.toLowerCase(Locale.ROOT), amount, BigInteger::add);
    }
}
