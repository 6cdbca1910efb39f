package com.keytrader.broker;

import com.keytrader.domain.enums.OrderSide;
import com.keytrader.domain.model.Instrument;
import java.util.Optional;

/**
 * Port to a real broker for live trading. The ledger never talks to it; only
 * {@link com.keytrader.oms.LiveOrderExecutor} does.
 *
 * <p>No implementation ships with the application. A deployment that runs with
 * {@code keytrader.trading.mode=LIVE} must provide one as a Spring bean.
 */
public interface BrokerGateway {

    /**
     * Places a market order.
     *
     * @param units quantity in units (lots * lot size)
     * @return the broker-assigned order id
     * @throws com.keytrader.exception.BrokerException if the broker rejects the order or is unreachable
     */
    String placeMarketOrder(Instrument instrument, OrderSide side, int units);

    /**
     * Looks up the execution state of an order in the broker's order book.
     *
     * @return the order status, or empty if the broker does not (yet) know the order
     */
    Optional<BrokerOrderStatus> getOrderStatus(String orderId);
}
