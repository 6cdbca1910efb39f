package com.keytrader.session;

import com.keytrader.domain.enums.OrderSide;
import com.keytrader.domain.model.Instrument;
import com.keytrader.domain.model.Order;
import com.keytrader.ledger.PositionManager;
import com.keytrader.oms.OrderExecutor;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Buy, sell and close-all commands against the current instrument. */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingCommandService {

    private final TradingSession tradingSession;
    private final OrderExecutor orderExecutor;
    private final PositionManager positionManager;

    public Order buy(int lots) {
        return place(OrderSide.BUY, lots);
    }

    public Order sell(int lots) {
        return place(OrderSide.SELL, lots);
    }

    public Order place(OrderSide side, int lots) {
        return tradingSession.withCurrentInstrument(instrument -> execute(instrument, side, lots));
    }

    /**
     * Sells every open lot. Returns empty, after logging a warning, when there is nothing to
     * close. The open quantity is read under the command lock, so concurrent close-alls sell
     * it once.
     */
    public Optional<Order> closeAll() {
        return tradingSession.withCurrentInstrument(instrument -> {
            int lots = positionManager.getOpenLots();
            if (lots <= 0) {
                log.warn("No open positions to close");
                return Optional.empty();
            }
            log.info("CLOSE ALL command: closing {} lots", lots);
            return Optional.of(execute(instrument, OrderSide.SELL, lots));
        });
    }

    private Order execute(Instrument instrument, OrderSide side, int lots) {
        log.info("{} {} lots of {}", side, lots, instrument.getSymbol());
        return orderExecutor.execute(instrument, side, lots);
    }
}
