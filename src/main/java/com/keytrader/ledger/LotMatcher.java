package com.keytrader.ledger;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Deque;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * LIFO matching of a sell against the pending buy lots.
 *
 * <p>The deque is walked from its newest end (the tail). Each lot gives up
 * {@code min(remaining sell, lot remaining)} units; exhausted lots are removed, a partially
 * consumed lot stays at the tail with its reduced quantity. Matching stops when the sell is
 * covered or the deque is empty, so a sell larger than all pending buys matches whatever exists.
 *
 * <p>Callers must hold the ledger lock; the deque is not thread-safe.
 */
final class LotMatcher {

    private static final Logger log = LoggerFactory.getLogger(LotMatcher.class);

    private LotMatcher() {}

    /**
     * Consumes pending lots for a sell.
     *
     * @return the aggregated match, or empty when nothing matched or the sell is invalid
     */
    static Optional<MatchedLots> matchLifo(Deque<PendingBuyLot> pendingLots, int sellQuantity, BigDecimal sellPrice) {
        if (sellQuantity <= 0) {
            log.warn("Invalid sell quantity for trade matching: {}", sellQuantity);
            return Optional.empty();
        }
        if (sellPrice == null || sellPrice.signum() <= 0) {
            log.warn("Invalid sell price for trade matching: {}", sellPrice);
            return Optional.empty();
        }

        int remaining = sellQuantity;
        int matchedQuantity = 0;
        BigDecimal matchedValue = BigDecimal.ZERO;
        LocalDateTime earliestEntry = null;

        while (remaining > 0 && !pendingLots.isEmpty()) {
            PendingBuyLot lot = pendingLots.peekLast();
            int matched = lot.consume(remaining);
            if (matched > 0) {
                matchedQuantity += matched;
                matchedValue = matchedValue.add(lot.getPrice().multiply(BigDecimal.valueOf(matched)));
                if (earliestEntry == null || lot.getTimestamp().isBefore(earliestEntry)) {
                    earliestEntry = lot.getTimestamp();
                }
                remaining -= matched;
            }
            if (lot.isExhausted()) {
                pendingLots.pollLast();
            }
        }

        if (matchedQuantity <= 0 || matchedValue.signum() <= 0) {
            log.debug("Sell of {} units matched no pending buys", sellQuantity);
            return Optional.empty();
        }
        if (remaining > 0) {
            log.debug("Sell of {} units exceeded pending buys by {} units", sellQuantity, remaining);
        }
        return Optional.of(new MatchedLots(matchedQuantity, matchedValue, earliestEntry));
    }
}
