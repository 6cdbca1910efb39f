package com.keytrader.oms;

import com.keytrader.domain.enums.OrderSide;
import com.keytrader.domain.enums.TradingMode;
import com.keytrader.domain.model.Instrument;
import com.keytrader.domain.model.Order;

/**
 * Executes a market order and feeds the resulting fill into the position ledger.
 *
 * <p>Implementations validate the command, wait for the order throttle, execute, record the
 * fill in the order history, apply it to the position and publish a
 * {@link com.keytrader.event.FillAppliedEvent}.
 */
public interface OrderExecutor {

    /**
     * @param lots quantity in lots, must be positive
     * @return the recorded fill
     * @throws com.keytrader.exception.OrderValidationException if side or lots are invalid
     * @throws com.keytrader.exception.BrokerException if no price is available or the broker fails
     */
    Order execute(Instrument instrument, OrderSide side, int lots);

    TradingMode getMode();
}
