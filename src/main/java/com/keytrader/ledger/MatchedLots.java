package com.keytrader.ledger;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import lombok.Value;

/** Aggregate of the pending buy lots consumed by one sell. */
@Value
public class MatchedLots {

    /** Total matched units. */
    int quantity;

    /** Sum of matched units * lot price. */
    BigDecimal value;

    /** Timestamp of the oldest consumed lot. */
    LocalDateTime earliestEntryTime;

    /** Volume-weighted average price of the consumed lots. */
    public BigDecimal getAveragePrice() {
        return value.divide(BigDecimal.valueOf(quantity), MathContext.DECIMAL64);
    }
}
