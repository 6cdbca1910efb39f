package com.keytrader.broker;

import com.keytrader.domain.model.MarketDepth;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory latest quote per symbol, fed by an upstream market data process through
 * {@code POST /api/market-data/quotes}. Lookups are lock-free.
 */
@Component
public class QuoteBoard implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(QuoteBoard.class);

    private final Map<String, MarketDepth> quotes = new ConcurrentHashMap<>();

    /** Replaces the quote for the depth's symbol. */
    public void update(MarketDepth depth) {
        quotes.put(depth.getSymbol(), depth);
        log.trace("Quote updated: {} ltp={} bid={} ask={}",
                depth.getSymbol(), depth.getLastPrice(), depth.getBestBid(), depth.getBestAsk());
    }

    @Override
    public BigDecimal getLastPrice(String symbol) {
        MarketDepth depth = quotes.get(symbol);
        if (depth == null || depth.getLastPrice() == null) {
            return BigDecimal.ZERO;
        }
        return depth.getLastPrice();
    }

    @Override
    public Optional<MarketDepth> getDepth(String symbol) {
        return Optional.ofNullable(quotes.get(symbol));
    }

    public int size() {
        return quotes.size();
    }
}
