package com.keytrader.session;

import com.keytrader.config.TradingConfig;
import com.keytrader.domain.model.Instrument;
import com.keytrader.exception.ErrorCode;
import com.keytrader.exception.InstrumentNotFoundException;
import com.keytrader.exception.TradingStateException;
import com.keytrader.ledger.PositionManager;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * The configured instruments and the one currently being traded.
 *
 * <p>Switching instrument is only allowed while flat, because lot size and prices of the open
 * position belong to the old instrument. A switch resets the ledger.
 *
 * <p>Order commands run through {@link #withCurrentInstrument(Function)}, which holds the same
 * lock as {@link #changeInstrument(String)}. A command therefore fills against the instrument
 * it started with, and a switch never interleaves with an order in flight.
 */
@Slf4j
@Component
public class TradingSession {

    private final List<Instrument> instruments;
    private final PositionManager positionManager;
    private final AtomicReference<Instrument> currentInstrument;
    private final ReentrantLock commandLock = new ReentrantLock();

    public TradingSession(TradingConfig tradingConfig, PositionManager positionManager) {
        if (tradingConfig.getInstruments().isEmpty()) {
            throw new IllegalStateException("keytrader.trading.instruments must list at least one instrument");
        }
        this.instruments = List.copyOf(tradingConfig.getInstruments());
        this.positionManager = positionManager;
        this.currentInstrument = new AtomicReference<>(instruments.get(0));
        log.info(
                "Selected instrument: {} ({}) [{}] lot size {}",
                instruments.get(0).getSymbol(),
                instruments.get(0).getExchange(),
                instruments.get(0).getProduct(),
                instruments.get(0).getLotSize());
    }

    public Instrument getCurrentInstrument() {
        return currentInstrument.get();
    }

    public List<Instrument> getInstruments() {
        return instruments;
    }

    public boolean isPaperMode() {
        return positionManager.isSimulationMode();
    }

    /**
     * Runs an order command against the current instrument. Commands and instrument switches
     * are serialized: each waits for the one before it to finish.
     */
    public <T> T withCurrentInstrument(Function<Instrument, T> command) {
        commandLock.lock();
        try {
            return command.apply(currentInstrument.get());
        } finally {
            commandLock.unlock();
        }
    }

    /**
     * Switches to the configured instrument with the given symbol.
     *
     * @throws TradingStateException with {@link ErrorCode#POSITION_OPEN} while a position is open
     * @throws InstrumentNotFoundException if the symbol is not configured
     */
    public Instrument changeInstrument(String symbol) {
        Instrument target = instruments.stream()
                .filter(instrument -> instrument.getSymbol().equals(symbol))
                .findFirst()
                .orElseThrow(() -> new InstrumentNotFoundException(symbol));

        commandLock.lock();
        try {
            if (positionManager.hasOpenPosition()) {
                log.warn("Cannot change instrument with open positions");
                throw new TradingStateException(
                        ErrorCode.POSITION_OPEN,
                        "Cannot change instrument with open positions",
                        Map.of("openLots", positionManager.getOpenLots()));
            }

            positionManager.reset();
            currentInstrument.set(target);
        } finally {
            commandLock.unlock();
        }
        log.info("Selected instrument: {} ({}) [{}]", target.getSymbol(), target.getExchange(), target.getProduct());
        return target;
    }
}
