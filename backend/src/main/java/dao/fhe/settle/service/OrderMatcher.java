package dao.fhe.settle.service;

import dao.fhe.settle.model.InternalizedTransfer;
import dao.fhe.settle.model.NetSwap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * FIFO coincidence-of-wants matching within one batch.
 * <p>
 * Intents are processed in submission order. Each keeps a queue per directed pair
 * (tokenIn to tokenOut); an incoming intent fills against the head of the reverse queue
 * until it or the queue is exhausted. A partially filled resting intent keeps its place at
 * the head. Whatever is left in a queue at the end becomes one {@link NetSwap}.
 * <p>
 * Amounts of both sides are compared raw, without price conversion.
 */
@Slf4j
@Component
public class OrderMatcher {

    public MatchResult match(List<ClearIntent> intents) {
        Map<DirectedPair, Deque<Residual>> queues = new LinkedHashMap<>();
        List<InternalizedTransfer> transfers = new ArrayList<>();
        Map<String, BigInteger> consumed = new LinkedHashMap<>();

        for (ClearIntent incoming : intents) {
            if (incoming.amount().signum() <= 0) {
                continue;
            }
            DirectedPair pair = DirectedPair.of(incoming.tokenIn(), incoming.tokenOut());
            Deque<Residual> reverse = queues.get(pair.reverse());
            BigInteger remaining = incoming.amount();

            while (remaining.signum() > 0 && reverse != null && !reverse.isEmpty()) {
                Residual resting = reverse.pollFirst();
                BigInteger matched = remaining.min(resting.remaining());
                ClearIntent a = resting.intent();
                transfers.add(new InternalizedTransfer(
                        a.intentId(), incoming.intentId(),
                        a.submitter(), incoming.submitter(),
                        a.tokenIn(), incoming.tokenIn(),
                        matched, matched));
                consumed.merge(a.intentId(), matched, BigInteger::add);
                consumed.merge(incoming.intentId(), matched, BigInteger::add);

                remaining = remaining.subtract(matched);
                BigInteger restingLeft = resting.remaining().subtract(matched);
                if (restingLeft.signum() > 0) {
                    reverse.offerFirst(new Residual(a, restingLeft));
                }
            }

            if (remaining.signum() > 0) {
                queues.computeIfAbsent(pair, k -> new ArrayDeque<>()).offerLast(new Residual(incoming, remaining));
            }
        }

        List<NetSwap> netSwaps = new ArrayList<>();
        for (Deque<Residual> queue : queues.values()) {
            if (queue.isEmpty()) continue;
            Residual first = queue.peekFirst();
            BigInteger total = BigInteger.ZERO;
            List<String> ids = new ArrayList<>();
            for (Residual r : queue) {
                total = total.add(r.remaining());
                ids.add(r.intent().intentId());
            }
            netSwaps.add(new NetSwap(first.intent().tokenIn(), first.intent().tokenOut(), total, ids));
        }

        log.debug("Matched {} intents: {} internalized transfers, {} net swaps",
                intents.size(), transfers.size(), netSwaps.size());
        return new MatchResult(transfers, netSwaps, consumed);
    }

    private record Residual(ClearIntent intent, BigInteger remaining) {}

    /** Token addresses compared case-insensitively. */
    private record DirectedPair(String tokenIn, String tokenOut) {

        static DirectedPair of(String tokenIn, String tokenOut) {
            return new DirectedPair(tokenIn.toLowerCase(Locale.ROOT), tokenOut.toLowerCase(Locale.ROOT));
        }

        DirectedPair reverse() {
            return new DirectedPair(tokenOut, tokenIn);
        }
    }
}
