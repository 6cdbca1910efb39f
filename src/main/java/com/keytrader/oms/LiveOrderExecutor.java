package com.keytrader.oms;

import com.keytrader.broker.BrokerGateway;
import com.keytrader.broker.BrokerOrderStatus;
import com.keytrader.domain.enums.OrderSide;
import com.keytrader.domain.enums.TradingMode;
import com.keytrader.domain.model.Instrument;
import com.keytrader.domain.model.Order;
import com.keytrader.event.FillAppliedEvent;
import com.keytrader.exception.BrokerException;
import com.keytrader.ledger.PositionManager;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Places market orders through the {@link BrokerGateway}, waits the configured fill-lookup
 * delay, then reads the broker's order book once to learn the fill. Only a filled order reaches the ledger; an order that is pending,
 * rejected or unknown to the broker is logged and returned without touching the position.
 */
public class LiveOrderExecutor implements OrderExecutor {

    private static final Logger log = LoggerFactory.getLogger(LiveOrderExecutor.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final PositionManager positionManager;
    private final BrokerGateway brokerGateway;
    private final OrderThrottle orderThrottle;
    private final ApplicationEventPublisher eventPublisher;
    private final long fillLookupDelayMillis;

    public LiveOrderExecutor(
            PositionManager positionManager,
            BrokerGateway brokerGateway,
            OrderThrottle orderThrottle,
            ApplicationEventPublisher eventPublisher,
            long fillLookupDelayMillis) {
        this.positionManager = positionManager;
        this.brokerGateway = brokerGateway;
        this.orderThrottle = orderThrottle;
        this.eventPublisher = eventPublisher;
        this.fillLookupDelayMillis = Math.max(0, fillLookupDelayMillis);
    }

    @Override
    public Order execute(Instrument instrument, OrderSide side, int lots) {
        OrderCommands.validate(instrument, side, lots);
        orderThrottle.acquire();

        int units = Math.multiplyExact(lots, instrument.getLotSize());
        String orderId;
        try {
            orderId = brokerGateway.placeMarketOrder(instrument, side, units);
        } catch (BrokerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BrokerException("Order placement failed: " + e.getMessage(), e);
        }
        log.info("[LIVE] Order placed: {} {} lots of {} -> {}", side, lots, instrument.getSymbol(), orderId);

        awaitFill(orderId);
        Optional<BrokerOrderStatus> status = lookupStatus(orderId);
        if (status.isEmpty()) {
            log.warn("No order book entry for {}; position not updated", orderId);
            return Order.builder()
                    .timestamp(LocalDateTime.now(IST))
                    .side(side)
                    .quantity(0)
                    .orderId(orderId)
                    .status("Unknown")
                    .build();
        }

        BrokerOrderStatus brokerStatus = status.get();
        if (!brokerStatus.isFilled() || brokerStatus.getFilledQuantity() < instrument.getLotSize()) {
            log.warn("Order {} not filled, status {}", orderId, brokerStatus.getStatusText());
            return Order.builder()
                    .timestamp(LocalDateTime.now(IST))
                    .side(side)
                    .quantity(0)
                    .price(brokerStatus.getAveragePrice())
                    .orderId(orderId)
                    .status(brokerStatus.getStatusText())
                    .build();
        }

        int filledLots = brokerStatus.getFilledQuantity() / instrument.getLotSize();
        LocalDateTime executedAt = LocalDateTime.now(IST);
        Order order = Order.builder()
                .timestamp(executedAt)
                .side(side)
                .quantity(filledLots)
                .price(brokerStatus.getAveragePrice())
                .orderId(orderId)
                .status(brokerStatus.getStatusText())
                .build();

        boolean tradeClosed =
                positionManager.recordAndApplyFill(order, instrument.getLotSize()).isPresent();

        log.info("[LIVE] {} filled: {} lots @ {}", orderId, filledLots, brokerStatus.getAveragePrice());
        eventPublisher.publishEvent(new FillAppliedEvent(this, order, positionManager.getPosition(), tradeClosed));
        return order;
    }

    /**
     * Gives a market order time to reach the exchange before its status is read. An interrupt
     * cuts the wait short and is passed on to the caller's thread; the lookup still runs.
     */
    private void awaitFill(String orderId) {
        if (fillLookupDelayMillis == 0) {
            return;
        }
        try {
            Thread.sleep(fillLookupDelayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for fill of {}", orderId);
        }
    }

    private Optional<BrokerOrderStatus> lookupStatus(String orderId) {
        try {
            return brokerGateway.getOrderStatus(orderId);
        } catch (RuntimeException e) {
            log.warn("Could not fetch status for order {}: {}", orderId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public TradingMode getMode() {
        return TradingMode.LIVE;
    }
}
