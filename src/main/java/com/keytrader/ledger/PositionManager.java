package com.keytrader.ledger;

import com.keytrader.domain.enums.OrderSide;
import com.keytrader.domain.model.Order;
import com.keytrader.domain.model.Position;
import com.keytrader.domain.model.SessionStats;
import com.keytrader.domain.model.Trade;
import com.keytrader.reporting.ExportResult;
import com.keytrader.reporting.SessionStatsCalculator;
import com.keytrader.reporting.TradeCsvExporter;
import java.math.BigDecimal;
import java.math.MathContext;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory ledger for one trading session: the current position, the fill history, the
 * closed trade history and the pending buy lots used to rebuild trades.
 *
 * <p>Every public method holds a single {@link ReentrantLock} for its whole in-memory part,
 * so callers observe a total order of fills, ticks and resets, and snapshots never see a
 * half-applied fill. All returned objects are copies. The CSV export copies the trade list
 * under the lock and writes the file after releasing it.
 *
 * <p>Cost basis: cumulative buy cost and buy units are tracked incrementally. A BUY adds to
 * both and recomputes {@code avgPrice = buyCost / buyUnits}. A SELL shrinks both
 * proportionally, which leaves the average price of the remaining quantity unchanged. When a
 * sell takes units to zero or below, everything is reset to an exact zero.
 *
 * <p>Simulation mode (fixed at construction) enables trade reconstruction: buys are queued as
 * pending lots and each sell is matched LIFO into a single {@link Trade}. Fills are assumed
 * to arrive in execution order.
 */
public class PositionManager {

    private static final Logger log = LoggerFactory.getLogger(PositionManager.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ReentrantLock lock = new ReentrantLock();

    private final boolean simulationMode;
    private final TradeCsvExporter tradeCsvExporter;

    private Position position = Position.flat();
    private final List<Order> orderHistory = new ArrayList<>();
    private final List<Trade> tradeHistory = new ArrayList<>();
    private final Deque<PendingBuyLot> pendingBuyLots = new ArrayDeque<>();

    private BigDecimal totalBuyCost = BigDecimal.ZERO;
    private int totalBuyUnits;
    private BigDecimal sessionNetPnl = BigDecimal.ZERO;

    public PositionManager(boolean simulationMode, TradeCsvExporter tradeCsvExporter) {
        this.simulationMode = simulationMode;
        this.tradeCsvExporter = tradeCsvExporter;
    }

    public boolean isSimulationMode() {
        return simulationMode;
    }

    /** Appends a fill record to the order history. Does not touch the position. */
    public void recordOrder(Order order) {
        lock.lock();
        try {
            orderHistory.add(order);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the fill's order and applies it to the position in one critical section, so no
     * snapshot sees the order without its position change. The order's quantity is in lots,
     * its timestamp is the execution time.
     *
     * @throws ArithmeticException if lots times lot size overflows; nothing is recorded then
     */
    public Optional<Trade> recordAndApplyFill(Order order, int lotSize) {
        int units = Math.multiplyExact(order.getQuantity(), lotSize);
        lock.lock();
        try {
            orderHistory.add(order);
            return applyFillLocked(order.getSide(), order.getQuantity(), units, order.getPrice(), order.getTimestamp());
        } finally {
            lock.unlock();
        }
    }

    /** Applies a fill executed now. */
    public Optional<Trade> applyFill(OrderSide side, int lots, BigDecimal price, int lotSize) {
        return applyFill(side, lots, price, lotSize, LocalDateTime.now(IST));
    }

    /**
     * Applies an executed fill to the position.
     *
     * <p>Lots, price and side are validated by the executors before they get here; this method
     * does not re-validate them.
     *
     * @param executedAt fill time, used as entry time of pending lots and exit time of trades
     * @return the trade closed by this fill; only a sell in simulation mode can close one
     * @throws ArithmeticException if lots times lot size overflows an int
     */
    public Optional<Trade> applyFill(
            OrderSide side, int lots, BigDecimal price, int lotSize, LocalDateTime executedAt) {
        int units = Math.multiplyExact(lots, lotSize);
        lock.lock();
        try {
            return applyFillLocked(side, lots, units, price, executedAt);
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private Optional<Trade> applyFillLocked(
            OrderSide side, int lots, int units, BigDecimal price, LocalDateTime executedAt) {
        Optional<Trade> closed = Optional.empty();
        if (side == OrderSide.BUY) {
            applyBuy(lots, units, price, executedAt);
        } else {
            closed = applySell(lots, units, price, executedAt);
        }

        if (position.getCmp().signum() > 0 && position.getQtyUnits() > 0) {
            recalculateMtm();
        }
        log.debug(
                "Fill applied: {} {} lots @ {} -> qty={} lots, avg={}",
                side,
                lots,
                price,
                position.getQtyLots(),
                position.getAvgPrice());
        return closed;
    }

    private void applyBuy(int lots, int units, BigDecimal price, LocalDateTime executedAt) {
        totalBuyCost = totalBuyCost.add(price.multiply(BigDecimal.valueOf(units)));
        totalBuyUnits += units;

        position.setQtyUnits(position.getQtyUnits() + units);
        position.setQtyLots(position.getQtyLots() + lots);

        if (totalBuyUnits > 0) {
            position.setAvgPrice(totalBuyCost.divide(BigDecimal.valueOf(totalBuyUnits), MathContext.DECIMAL64));
        }
        position.setTotalValue(position.getAvgPrice().multiply(BigDecimal.valueOf(position.getQtyUnits())));

        if (simulationMode) {
            pendingBuyLots.addLast(new PendingBuyLot(executedAt, price, units));
        }
    }

    private Optional<Trade> applySell(int lots, int units, BigDecimal price, LocalDateTime executedAt) {
        Optional<Trade> closed = simulationMode ? recordClosedTrade(units, price, executedAt) : Optional.empty();

        position.setQtyUnits(position.getQtyUnits() - units);
        position.setQtyLots(position.getQtyLots() - lots);

        if (totalBuyUnits > 0) {
            BigDecimal costReduction = BigDecimal.valueOf(units)
                    .multiply(totalBuyCost)
                    .divide(BigDecimal.valueOf(totalBuyUnits), MathContext.DECIMAL64);
            totalBuyCost = totalBuyCost.subtract(costReduction);
            totalBuyUnits -= units;
        }

        if (position.getQtyUnits() <= 0) {
            position = Position.builder().cmp(position.getCmp()).build();
            totalBuyCost = BigDecimal.ZERO;
            totalBuyUnits = 0;
            log.debug("Position flattened");
        } else {
            position.setTotalValue(position.getAvgPrice().multiply(BigDecimal.valueOf(position.getQtyUnits())));
        }
        return closed;
    }

    /**
     * Matches the sell against pending lots and books the resulting trade. A failure to build
     * the trade is logged and swallowed: the position update must still happen.
     */
    private Optional<Trade> recordClosedTrade(int units, BigDecimal price, LocalDateTime executedAt) {
        Optional<MatchedLots> match = LotMatcher.matchLifo(pendingBuyLots, units, price);
        if (match.isEmpty()) {
            return Optional.empty();
        }
        MatchedLots matched = match.get();
        try {
            Trade trade = Trade.close(
                    matched.getEarliestEntryTime(),
                    matched.getAveragePrice(),
                    matched.getQuantity(),
                    executedAt,
                    price,
                    matched.getQuantity());
            tradeHistory.add(trade);
            sessionNetPnl = sessionNetPnl.add(trade.getPnl());
            log.info(
                    "Trade closed: {} units, entry {} exit {}, P&L {}",
                    trade.getQuantity(),
                    trade.getEntryPrice(),
                    trade.getExitPrice(),
                    trade.getPnl());
            return Optional.of(trade);
        } catch (RuntimeException e) {
            log.error("Error creating trade record: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Stores the latest market price and revalues the open quantity. The price is stored as
     * given; MTM is only computed from a positive price.
     */
    public void applyPriceTick(BigDecimal price) {
        lock.lock();
        try {
            position.setCmp(price != null ? price : BigDecimal.ZERO);
            if (position.getQtyUnits() > 0) {
                recalculateMtm();
            }
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private void recalculateMtm() {
        if (position.getQtyUnits() <= 0 || position.getCmp().signum() <= 0) {
            position.setMtm(BigDecimal.ZERO);
            position.setMtmChangePercent(BigDecimal.ZERO);
            return;
        }

        BigDecimal currentValue = position.getCmp().multiply(BigDecimal.valueOf(position.getQtyUnits()));
        BigDecimal mtm = currentValue.subtract(position.getTotalValue());
        position.setMtm(mtm);

        if (position.getTotalValue().signum() > 0) {
            position.setMtmChangePercent(
                    mtm.divide(position.getTotalValue(), MathContext.DECIMAL64).multiply(HUNDRED));
        } else {
            position.setMtmChangePercent(BigDecimal.ZERO);
        }
    }

    public Position getPosition() {
        lock.lock();
        try {
            return position.copy();
        } finally {
            lock.unlock();
        }
    }

    public List<Order> getOrderHistory() {
        lock.lock();
        try {
            return List.copyOf(orderHistory);
        } finally {
            lock.unlock();
        }
    }

    public List<Trade> getTradeHistory() {
        lock.lock();
        try {
            return List.copyOf(tradeHistory);
        } finally {
            lock.unlock();
        }
    }

    public SessionStats getSessionStats() {
        lock.lock();
        try {
            return SessionStatsCalculator.calculate(tradeHistory, sessionNetPnl);
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal getSessionNetPnl() {
        lock.lock();
        try {
            return sessionNetPnl;
        } finally {
            lock.unlock();
        }
    }

    public int getOpenLots() {
        lock.lock();
        try {
            return position.getQtyLots();
        } finally {
            lock.unlock();
        }
    }

    public boolean hasOpenPosition() {
        lock.lock();
        try {
            return position.isOpen();
        } finally {
            lock.unlock();
        }
    }

    /** Number of buy lots still waiting to be matched. Always zero outside simulation mode. */
    public int getPendingLotCount() {
        lock.lock();
        try {
            return pendingBuyLots.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Zeros the position and clears the order history and pending lots. In simulation mode the
     * trade history and session P&amp;L survive, so a paper session keeps its ledger across
     * instrument switches; in live mode they are cleared with the instrument.
     */
    public void reset() {
        lock.lock();
        try {
            position = Position.flat();
            orderHistory.clear();
            if (!simulationMode) {
                tradeHistory.clear();
                sessionNetPnl = BigDecimal.ZERO;
            }
            totalBuyCost = BigDecimal.ZERO;
            totalBuyUnits = 0;
            pendingBuyLots.clear();
            log.info("Position ledger reset (trade history {})", simulationMode ? "kept" : "cleared");
        } finally {
            lock.unlock();
        }
    }

    /** Exports the trade history to a timestamped file in the export directory. */
    public ExportResult exportTrades() {
        List<Trade> trades = getTradeHistory();
        if (trades.isEmpty()) {
            log.info("No trades to export");
            return ExportResult.nothingToExport();
        }
        return tradeCsvExporter.export(trades, LocalDateTime.now(IST));
    }

    /** Exports the trade history to the given file. */
    public ExportResult exportTrades(Path file) {
        if (file == null) {
            return exportTrades();
        }
        List<Trade> trades = getTradeHistory();
        if (trades.isEmpty()) {
            log.info("No trades to export");
            return ExportResult.nothingToExport();
        }
        return tradeCsvExporter.export(trades, file);
    }
}
