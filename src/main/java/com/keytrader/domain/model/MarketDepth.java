package com.keytrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Top of book for one symbol. Any field may be null or zero when the feed has not supplied it.
 */
@Value
@Builder
public class MarketDepth {

    String symbol;
    BigDecimal bestBid;
    BigDecimal bestAsk;
    BigDecimal lastPrice;
}
