package com.keytrader.observability;

import com.keytrader.domain.enums.OrderSide;
import com.keytrader.event.FillAppliedEvent;
import com.keytrader.ledger.PositionManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer metrics for the trading session:
 * <ul>
 *   <li><b>fills.buy.count</b>, <b>fills.sell.count</b> (counters): fills applied per side</li>
 *   <li><b>trades.closed.count</b> (counter): sells that produced a closed trade</li>
 *   <li><b>session.net.pnl</b> (gauge): realised P&amp;L of the session</li>
 *   <li><b>position.mtm</b> (gauge): unrealised P&amp;L of the open position</li>
 *   <li><b>position.lots</b> (gauge): open lots</li>
 * </ul>
 */
@Service
public class TradingMetricsService {

    private final Counter buyFillCounter;
    private final Counter sellFillCounter;
    private final Counter tradesClosedCounter;

    public TradingMetricsService(MeterRegistry meterRegistry, PositionManager positionManager) {
        this.buyFillCounter = Counter.builder("fills.buy.count")
                .description("Buy fills applied to the position")
                .register(meterRegistry);
        this.sellFillCounter = Counter.builder("fills.sell.count")
                .description("Sell fills applied to the position")
                .register(meterRegistry);
        this.tradesClosedCounter = Counter.builder("trades.closed.count")
                .description("Round-trip trades closed in the session")
                .register(meterRegistry);

        meterRegistry.gauge("session.net.pnl", positionManager, manager -> manager.getSessionNetPnl()
                .doubleValue());
        meterRegistry.gauge("position.mtm", positionManager, manager -> manager.getPosition()
                .getMtm()
                .doubleValue());
        meterRegistry.gauge("position.lots", positionManager, PositionManager::getOpenLots);
    }

    @EventListener
    public void onFillApplied(FillAppliedEvent event) {
        if (event.getOrder().getSide() == OrderSide.BUY) {
            buyFillCounter.increment();
        } else {
            sellFillCounter.increment();
        }
        if (event.isTradeClosed()) {
            tradesClosedCounter.increment();
        }
    }

    public Counter getBuyFillCounter() {
        return buyFillCounter;
    }

    public Counter getSellFillCounter() {
        return sellFillCounter;
    }

    public Counter getTradesClosedCounter() {
        return tradesClosedCounter;
    }
}
