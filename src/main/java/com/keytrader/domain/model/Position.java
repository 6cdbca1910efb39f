package com.keytrader.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Aggregate long holding of the current instrument.
 *
 * <p>Mutated in place only by the PositionManager under its lock. Everything handed out to
 * callers is a {@link #copy()}.
 *
 * <p>qtyUnits is always qtyLots * lotSize. mtm and mtmChangePercent are only non-zero while
 * qtyUnits &gt; 0 and a positive cmp has been observed.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
public class Position {

    private int qtyLots;
    private int qtyUnits;

    /** Cost value of the open quantity: qtyUnits * avgPrice. */
    @Builder.Default
    private BigDecimal totalValue = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal avgPrice = BigDecimal.ZERO;

    /** Current market price (last traded price from the poller). */
    @Builder.Default
    private BigDecimal cmp = BigDecimal.ZERO;

    /** Unrealized P&amp;L: qtyUnits * cmp - totalValue. */
    @Builder.Default
    private BigDecimal mtm = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal mtmChangePercent = BigDecimal.ZERO;

    public static Position flat() {
        return Position.builder().build();
    }

    public Position copy() {
        return toBuilder().build();
    }

    public boolean isOpen() {
        return qtyUnits != 0;
    }
}
