package com.keytrader.marketdata;

import com.keytrader.broker.MarketDataProvider;
import com.keytrader.ledger.PositionManager;
import com.keytrader.session.TradingSession;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Feeds the latest traded price of the current instrument into the ledger while a position is
 * open. A missing or non-positive price skips the tick.
 */
@Component
public class PriceTickPoller {

    private static final Logger log = LoggerFactory.getLogger(PriceTickPoller.class);

    private final PositionManager positionManager;
    private final MarketDataProvider marketDataProvider;
    private final TradingSession tradingSession;

    public PriceTickPoller(
            PositionManager positionManager, MarketDataProvider marketDataProvider, TradingSession tradingSession) {
        this.positionManager = positionManager;
        this.marketDataProvider = marketDataProvider;
        this.tradingSession = tradingSession;
    }

    @Scheduled(
            fixedDelayString = "${keytrader.trading.price-poll-interval-ms:5000}",
            initialDelayString = "${keytrader.trading.price-poll-interval-ms:5000}")
    public void poll() {
        if (!positionManager.hasOpenPosition()) {
            return;
        }
        String symbol = tradingSession.getCurrentInstrument().getSymbol();
        try {
            BigDecimal price = marketDataProvider.getLastPrice(symbol);
            if (price != null && price.signum() > 0) {
                positionManager.applyPriceTick(price);
            } else {
                log.debug("No price for {}, tick skipped", symbol);
            }
        } catch (RuntimeException e) {
            log.debug("Price fetch skipped: {}", e.getMessage());
        }
    }
}
