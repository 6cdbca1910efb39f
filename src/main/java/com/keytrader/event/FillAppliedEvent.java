package com.keytrader.event;

import com.keytrader.domain.model.Order;
import com.keytrader.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the order executors after a fill has been recorded and applied to the ledger.
 *
 * <p>Carries the fill and the position snapshot taken right after it. Listeners:
 * TradingMetricsService (fill counters).
 */
public class FillAppliedEvent extends ApplicationEvent {

    private final Order order;
    private final Position position;
    private final boolean tradeClosed;

    public FillAppliedEvent(Object source, Order order, Position position, boolean tradeClosed) {
        super(source);
        this.order = order;
        this.position = position;
        this.tradeClosed = tradeClosed;
    }

    public Order getOrder() {
        return order;
    }

    public Position getPosition() {
        return position;
    }

    /** True when the fill was a sell that produced a closed trade. */
    public boolean isTradeClosed() {
        return tradeClosed;
    }
}
