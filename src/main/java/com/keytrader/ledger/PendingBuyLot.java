package com.keytrader.ledger;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A buy fill that has not yet been fully matched against sells. Quantity is in units and
 * only ever decreases; it never goes below zero.
 */
final class PendingBuyLot {

    private final LocalDateTime timestamp;
    private final BigDecimal price;
    private int remainingQuantity;

    PendingBuyLot(LocalDateTime timestamp, BigDecimal price, int quantity) {
        this.timestamp = timestamp;
        this.price = price;
        this.remainingQuantity = quantity;
    }

    LocalDateTime getTimestamp() {
        return timestamp;
    }

    BigDecimal getPrice() {
        return price;
    }

    int getRemainingQuantity() {
        return remainingQuantity;
    }

    /**
     * Takes up to {@code requested} units from this lot.
     *
     * @return the number of units actually consumed
     */
    int consume(int requested) {
        int consumed = Math.min(requested, remainingQuantity);
        remainingQuantity -= consumed;
        return consumed;
    }

    boolean isExhausted() {
        return remainingQuantity <= 0;
    }
}
