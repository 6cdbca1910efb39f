package com.keytrader.oms;

import com.keytrader.broker.MarketDataProvider;
import com.keytrader.domain.enums.OrderSide;
import com.keytrader.domain.enums.TradingMode;
import com.keytrader.domain.model.Instrument;
import com.keytrader.domain.model.MarketDepth;
import com.keytrader.domain.model.Order;
import com.keytrader.domain.model.Trade;
import com.keytrader.event.FillAppliedEvent;
import com.keytrader.exception.BrokerException;
import com.keytrader.exception.ErrorCode;
import com.keytrader.ledger.PositionManager;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Simulated execution against the current quote. A BUY fills at the best ask and a SELL at the
 * best bid; either falls back to the last traded price when that side of the book is empty.
 * Fills are always complete.
 */
public class PaperOrderExecutor implements OrderExecutor {

    private static final Logger log = LoggerFactory.getLogger(PaperOrderExecutor.class);

    static final String PAPER_STATUS = "Paper Executed";

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final PositionManager positionManager;
    private final MarketDataProvider marketDataProvider;
    private final OrderThrottle orderThrottle;
    private final PaperOrderIdGenerator orderIdGenerator;
    private final ApplicationEventPublisher eventPublisher;

    public PaperOrderExecutor(
            PositionManager positionManager,
            MarketDataProvider marketDataProvider,
            OrderThrottle orderThrottle,
            PaperOrderIdGenerator orderIdGenerator,
            ApplicationEventPublisher eventPublisher) {
        this.positionManager = positionManager;
        this.marketDataProvider = marketDataProvider;
        this.orderThrottle = orderThrottle;
        this.orderIdGenerator = orderIdGenerator;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public Order execute(Instrument instrument, OrderSide side, int lots) {
        OrderCommands.validate(instrument, side, lots);
        orderThrottle.acquire();

        BigDecimal price = fillPrice(instrument.getSymbol(), side);
        if (price.signum() <= 0) {
            throw new BrokerException(
                    ErrorCode.NO_MARKET_PRICE, instrument.getSymbol(), "No market price for " + instrument.getSymbol());
        }

        LocalDateTime executedAt = LocalDateTime.now(IST);
        Order order = Order.builder()
                .timestamp(executedAt)
                .side(side)
                .quantity(lots)
                .price(price)
                .orderId(orderIdGenerator.next())
                .status(PAPER_STATUS)
                .build();

        Optional<Trade> closed = positionManager.recordAndApplyFill(order, instrument.getLotSize());

        log.info("[PAPER] {} {} lots of {} @ {} ({})", side, lots, instrument.getSymbol(), price, order.getOrderId());
        eventPublisher.publishEvent(
                new FillAppliedEvent(this, order, positionManager.getPosition(), closed.isPresent()));
        return order;
    }

    private BigDecimal fillPrice(String symbol, OrderSide side) {
        Optional<MarketDepth> depth = marketDataProvider.getDepth(symbol);
        if (depth.isPresent()) {
            BigDecimal touch = side == OrderSide.BUY ? depth.get().getBestAsk() : depth.get().getBestBid();
            if (touch != null && touch.signum() > 0) {
                return touch;
            }
        }
        BigDecimal lastPrice = marketDataProvider.getLastPrice(symbol);
        return lastPrice != null ? lastPrice : BigDecimal.ZERO;
    }

    @Override
    public TradingMode getMode() {
        return TradingMode.PAPER;
    }
}
