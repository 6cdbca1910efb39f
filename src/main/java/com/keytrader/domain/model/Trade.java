package com.keytrader.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A closed round-trip: one or more buy lots matched against a single sell.
 *
 * <p>Only the lot matcher creates trades. All derived metrics are computed once at
 * construction:
 * <ul>
 *   <li>quantity = min(entryQuantity, exitQuantity)</li>
 *   <li>pnl = (exitPrice - entryPrice) * quantity</li>
 *   <li>pnlPercent = (exitPrice - entryPrice) / entryPrice * 100, zero for a non-positive entry price</li>
 *   <li>turnover = (entryPrice + exitPrice) * quantity</li>
 * </ul>
 *
 * <p>Quantities are units (lots * lot size).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Trade {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    LocalDateTime entryTime;
    BigDecimal entryPrice;
    int entryQuantity;
    LocalDateTime exitTime;
    BigDecimal exitPrice;
    int exitQuantity;

    /** Matched quantity actually traded. */
    int quantity;

    BigDecimal pnl;
    BigDecimal pnlPercent;

    /** Whole seconds between entry and exit, truncated. */
    long durationSeconds;

    BigDecimal turnover;

    /**
     * Builds a closed trade and computes its derived metrics.
     *
     * @throws IllegalArgumentException if the matched quantity is not positive or a field is missing
     */
    public static Trade close(
            LocalDateTime entryTime,
            BigDecimal entryPrice,
            int entryQuantity,
            LocalDateTime exitTime,
            BigDecimal exitPrice,
            int exitQuantity) {
        if (entryTime == null || exitTime == null || entryPrice == null || exitPrice == null) {
            throw new IllegalArgumentException("Trade requires entry and exit time and price");
        }
        int quantity = Math.min(entryQuantity, exitQuantity);
        if (quantity <= 0) {
            throw new IllegalArgumentException("Trade quantity must be positive, was " + quantity);
        }

        BigDecimal qty = BigDecimal.valueOf(quantity);
        BigDecimal priceDiff = exitPrice.subtract(entryPrice);
        BigDecimal pnl = priceDiff.multiply(qty);
        BigDecimal pnlPercent = entryPrice.signum() > 0
                ? priceDiff.divide(entryPrice, MathContext.DECIMAL64).multiply(HUNDRED)
                : BigDecimal.ZERO;
        long durationSeconds = ChronoUnit.SECONDS.between(entryTime, exitTime);
        BigDecimal turnover = entryPrice.add(exitPrice).multiply(qty);

        return new Trade(
                entryTime,
                entryPrice,
                entryQuantity,
                exitTime,
                exitPrice,
                exitQuantity,
                quantity,
                pnl,
                pnlPercent,
                durationSeconds,
                turnover);
    }

    public boolean isWinner() {
        return pnl.signum() > 0;
    }

    public boolean isLoser() {
        return pnl.signum() < 0;
    }
}
