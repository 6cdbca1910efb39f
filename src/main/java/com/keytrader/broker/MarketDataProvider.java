package com.keytrader.broker;

import com.keytrader.domain.model.MarketDepth;
import java.math.BigDecimal;
import java.util.Optional;

/** Source of current prices for the poller and the paper executor. */
public interface MarketDataProvider {

    /** Last traded price, or zero when no price is known. */
    BigDecimal getLastPrice(String symbol);

    /** Top of book, or empty when the symbol has never been quoted. */
    Optional<MarketDepth> getDepth(String symbol);
}
