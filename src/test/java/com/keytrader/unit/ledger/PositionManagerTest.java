package com.keytrader.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.keytrader.domain.enums.OrderSide;
import com.keytrader.domain.model.Order;
import com.keytrader.domain.model.Position;
import com.keytrader.domain.model.SessionStats;
import com.keytrader.domain.model.Trade;
import com.keytrader.ledger.PositionManager;
import com.keytrader.reporting.ExportResult;
import com.keytrader.reporting.TradeCsvExporter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for PositionManager covering cost basis, flattening, LIFO trade reconstruction,
 * mark-to-market, session statistics, snapshots, reset and export.
 */
class PositionManagerTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 10, 6, 9, 20, 0);

    @TempDir
    Path tempDir;

    private PositionManager paperManager;
    private PositionManager liveManager;

    @BeforeEach
    void setUp() {
        paperManager = new PositionManager(true, new TradeCsvExporter(tempDir.resolve("trades")));
        liveManager = new PositionManager(false, new TradeCsvExporter(tempDir.resolve("live")));
    }

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    private static BigDecimal round2(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    // ==============================
    // COST BASIS
    // ==============================

    @Nested
    @DisplayName("Cost Basis")
    class CostBasis {

        @Test
        @DisplayName("Single buy sets quantity, average price and total value")
        void singleBuy() {
            paperManager.applyFill(OrderSide.BUY, 2, bd("100"), 75, T0);

            Position position = paperManager.getPosition();
            assertThat(position.getQtyLots()).isEqualTo(2);
            assertThat(position.getQtyUnits()).isEqualTo(150);
            assertThat(position.getAvgPrice()).isEqualByComparingTo("100");
            assertThat(position.getTotalValue()).isEqualByComparingTo("15000");
        }

        @Test
        @DisplayName("Average price of buys is the volume weighted average")
        void buysAverageToVwap() {
            paperManager.applyFill(OrderSide.BUY, 1, bd("100"), 10, T0);
            paperManager.applyFill(OrderSide.BUY, 3, bd("120"), 10, T0.plusSeconds(5));

            // (10 * 100 + 30 * 120) / 40 = 115
            Position position = paperManager.getPosition();
            assertThat(position.getQtyUnits()).isEqualTo(40);
            assertThat(position.getAvgPrice()).isEqualByComparingTo("115");
            assertThat(position.getTotalValue()).isEqualByComparingTo("4600");
        }

        @Test
        @DisplayName("Partial sell keeps the average price of the remaining quantity")
        void partialSellKeepsAverage() {
            paperManager.applyFill(OrderSide.BUY, 10, bd("100"), 1, T0);
            paperManager.applyFill(OrderSide.BUY, 10, bd("110"), 1, T0.plusSeconds(1));
            paperManager.applyFill(OrderSide.SELL, 5, bd("120"), 1, T0.plusSeconds(2));

            Position position = paperManager.getPosition();
            assertThat(position.getQtyLots()).isEqualTo(15);
            assertThat(position.getQtyUnits()).isEqualTo(15);
            assertThat(position.getAvgPrice()).isEqualByComparingTo("105");
            assertThat(position.getTotalValue()).isEqualByComparingTo("1575");
        }

        @Test
        @DisplayName("Buy after a partial sell averages against the remaining cost")
        void buyAfterPartialSell() {
            paperManager.applyFill(OrderSide.BUY, 10, bd("100"), 1, T0);
            paperManager.applyFill(OrderSide.SELL, 5, bd("105"), 1, T0.plusSeconds(1));
            paperManager.applyFill(OrderSide.BUY, 5, bd("110"), 1, T0.plusSeconds(2));

            // remaining cost 500 + 550 over 10 units
            assertThat(paperManager.getPosition().getAvgPrice()).isEqualByComparingTo("105");
        }

        @Test
        @DisplayName("Units always equal lots times lot size")
        void unitsMatchLots() {
            paperManager.applyFill(OrderSide.BUY, 3, bd("100"), 25, T0);
            paperManager.applyFill(OrderSide.SELL, 1, bd("101"), 25, T0.plusSeconds(1));

            Position position = paperManager.getPosition();
            assertThat(position.getQtyUnits()).isEqualTo(position.getQtyLots() * 25);
        }
    }

    // ==============================
    // FLATTENING
    // ==============================

    @Nested
    @DisplayName("Flattening")
    class Flattening {

        @Test
        @DisplayName("Selling everything zeros the position but keeps the last price")
        void sellAllResetsPosition() {
            paperManager.applyFill(OrderSide.BUY, 2, bd("100"), 50, T0);
            paperManager.applyPriceTick(bd("102"));
            paperManager.applyFill(OrderSide.SELL, 2, bd("103"), 50, T0.plusSeconds(30));

            Position position = paperManager.getPosition();
            assertThat(position.getQtyLots()).isZero();
            assertThat(position.getQtyUnits()).isZero();
            assertThat(position.getAvgPrice()).isEqualByComparingTo("0");
            assertThat(position.getTotalValue()).isEqualByComparingTo("0");
            assertThat(position.getMtm()).isEqualByComparingTo("0");
            assertThat(position.getMtmChangePercent()).isEqualByComparingTo("0");
            assertThat(position.getCmp()).isEqualByComparingTo("102");
            assertThat(paperManager.hasOpenPosition()).isFalse();
        }

        @Test
        @DisplayName("Overselling flattens instead of going short")
        void oversellFlattens() {
            liveManager.applyFill(OrderSide.BUY, 1, bd("100"), 10, T0);
            liveManager.applyFill(OrderSide.SELL, 3, bd("101"), 10, T0.plusSeconds(1));

            Position position = liveManager.getPosition();
            assertThat(position.getQtyUnits()).isZero();
            assertThat(position.getQtyLots()).isZero();
            assertThat(position.getAvgPrice()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("A new buy after flattening starts a fresh cost basis")
        void freshCostBasisAfterFlat() {
            paperManager.applyFill(OrderSide.BUY, 1, bd("100"), 1, T0);
            paperManager.applyFill(OrderSide.SELL, 1, bd("110"), 1, T0.plusSeconds(1));
            paperManager.applyFill(OrderSide.BUY, 1, bd("200"), 1, T0.plusSeconds(2));

            assertThat(paperManager.getPosition().getAvgPrice()).isEqualByComparingTo("200");
        }
    }

    // ==============================
    // TRADE RECONSTRUCTION
    // ==============================

    @Nested
    @DisplayName("LIFO Trade Reconstruction")
    class TradeReconstruction {

        @Test
        @DisplayName("Sell matches the most recent buy first")
        void lifoMatchesNewestBuy() {
            paperManager.applyFill(OrderSide.BUY, 10, bd("100"), 1, T0);
            paperManager.applyFill(OrderSide.BUY, 10, bd("110"), 1, T0.plusMinutes(1));
            Optional<Trade> closed = paperManager.applyFill(OrderSide.SELL, 5, bd("120"), 1, T0.plusMinutes(2));

            assertThat(closed).isPresent();
            Trade trade = closed.get();
            assertThat(trade.getEntryQuantity()).isEqualTo(5);
            assertThat(trade.getExitQuantity()).isEqualTo(5);
            assertThat(trade.getQuantity()).isEqualTo(5);
            assertThat(trade.getEntryPrice()).isEqualByComparingTo("110");
            assertThat(trade.getExitPrice()).isEqualByComparingTo("120");
            assertThat(trade.getPnl()).isEqualByComparingTo("50");
            assertThat(trade.getEntryTime()).isEqualTo(T0.plusMinutes(1));
            assertThat(trade.getExitTime()).isEqualTo(T0.plusMinutes(2));
            assertThat(trade.getDurationSeconds()).isEqualTo(60);
            assertThat(paperManager.getTradeHistory()).containsExactly(trade);
            assertThat(paperManager.getPendingLotCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("A sell spanning several buys collapses into one trade")
        void multiLotCollapse() {
            paperManager.applyFill(OrderSide.BUY, 10, bd("100"), 1, T0);
            paperManager.applyFill(OrderSide.BUY, 10, bd("110"), 1, T0.plusMinutes(1));
            paperManager.applyFill(OrderSide.SELL, 15, bd("120"), 1, T0.plusMinutes(5));

            List<Trade> trades = paperManager.getTradeHistory();
            assertThat(trades).hasSize(1);
            Trade trade = trades.get(0);
            // 10 @ 110 then 5 @ 100
            assertThat(trade.getEntryQuantity()).isEqualTo(15);
            assertThat(round2(trade.getEntryPrice())).isEqualByComparingTo("106.67");
            assertThat(round2(trade.getPnl())).isEqualByComparingTo("200.00");
            assertThat(trade.getEntryTime()).isEqualTo(T0);
            assertThat(paperManager.getPendingLotCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Sell larger than pending buys matches what exists")
        void sellLargerThanPending() {
            paperManager.applyFill(OrderSide.BUY, 5, bd("100"), 1, T0);
            paperManager.applyFill(OrderSide.SELL, 8, bd("90"), 1, T0.plusSeconds(10));

            Trade trade = paperManager.getTradeHistory().get(0);
            assertThat(trade.getQuantity()).isEqualTo(5);
            assertThat(trade.getPnl()).isEqualByComparingTo("-50");
            assertThat(paperManager.getPendingLotCount()).isZero();
        }

        @Test
        @DisplayName("Sell with nothing pending records no trade")
        void sellWithoutPending() {
            Optional<Trade> closed = paperManager.applyFill(OrderSide.SELL, 1, bd("100"), 1, T0);

            assertThat(closed).isEmpty();
            assertThat(paperManager.getTradeHistory()).isEmpty();
            assertThat(paperManager.getPosition().getQtyUnits()).isZero();
        }

        @Test
        @DisplayName("Sell at a non-positive price updates the position without a trade")
        void zeroPriceSell() {
            paperManager.applyFill(OrderSide.BUY, 2, bd("100"), 1, T0);
            Optional<Trade> closed = paperManager.applyFill(OrderSide.SELL, 1, BigDecimal.ZERO, 1, T0.plusSeconds(1));

            assertThat(closed).isEmpty();
            assertThat(paperManager.getTradeHistory()).isEmpty();
            assertThat(paperManager.getPosition().getQtyUnits()).isEqualTo(1);
        }

        @Test
        @DisplayName("Session net P&L accumulates closed trades")
        void sessionNetPnlAccumulates() {
            paperManager.applyFill(OrderSide.BUY, 10, bd("100"), 1, T0);
            paperManager.applyFill(OrderSide.SELL, 5, bd("104"), 1, T0.plusSeconds(1));
            paperManager.applyFill(OrderSide.SELL, 5, bd("98"), 1, T0.plusSeconds(2));

            // +20 then -10
            assertThat(paperManager.getSessionNetPnl()).isEqualByComparingTo("10");
            assertThat(paperManager.getTradeHistory()).hasSize(2);
        }

        @Test
        @DisplayName("Live mode never reconstructs trades")
        void liveModeHasNoTrades() {
            liveManager.applyFill(OrderSide.BUY, 10, bd("100"), 1, T0);
            Optional<Trade> closed = liveManager.applyFill(OrderSide.SELL, 10, bd("120"), 1, T0.plusSeconds(1));

            assertThat(closed).isEmpty();
            assertThat(liveManager.getTradeHistory()).isEmpty();
            assertThat(liveManager.getPendingLotCount()).isZero();
            assertThat(liveManager.getSessionNetPnl()).isEqualByComparingTo("0");
        }
    }

    // ==============================
    // MARK TO MARKET
    // ==============================

    @Nested
    @DisplayName("Mark to Market")
    class MarkToMarket {

        @Test
        @DisplayName("Price tick revalues the open position")
        void priceTickComputesMtm() {
            paperManager.applyFill(OrderSide.BUY, 10, bd("100"), 25, T0);
            paperManager.applyPriceTick(bd("105"));

            Position position = paperManager.getPosition();
            assertThat(position.getCmp()).isEqualByComparingTo("105");
            assertThat(position.getMtm()).isEqualByComparingTo("1250");
            assertThat(position.getMtmChangePercent()).isEqualByComparingTo("5.0");
        }

        @Test
        @DisplayName("Fill after a tick recomputes MTM against the last price")
        void fillAfterTick() {
            paperManager.applyPriceTick(bd("100"));
            paperManager.applyFill(OrderSide.BUY, 1, bd("98"), 10, T0);

            assertThat(paperManager.getPosition().getMtm()).isEqualByComparingTo("20");
        }

        @Test
        @DisplayName("Tick while flat only stores the price")
        void tickWhileFlat() {
            paperManager.applyPriceTick(bd("250"));

            Position position = paperManager.getPosition();
            assertThat(position.getCmp()).isEqualByComparingTo("250");
            assertThat(position.getMtm()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Non-positive tick zeros MTM")
        void zeroTick() {
            paperManager.applyFill(OrderSide.BUY, 1, bd("100"), 10, T0);
            paperManager.applyPriceTick(bd("110"));
            paperManager.applyPriceTick(BigDecimal.ZERO);

            Position position = paperManager.getPosition();
            assertThat(position.getMtm()).isEqualByComparingTo("0");
            assertThat(position.getMtmChangePercent()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Null tick is stored as zero")
        void nullTick() {
            paperManager.applyPriceTick(null);

            assertThat(paperManager.getPosition().getCmp()).isEqualByComparingTo("0");
        }
    }

    // ==============================
    // STATS AND SNAPSHOTS
    // ==============================

    @Nested
    @DisplayName("Stats and Snapshots")
    class StatsAndSnapshots {

        @Test
        @DisplayName("Stats are all zero without trades")
        void emptyStats() {
            SessionStats stats = paperManager.getSessionStats();

            assertThat(stats.getTotalTrades()).isZero();
            assertThat(stats.getWinningTrades()).isZero();
            assertThat(stats.getLosingTrades()).isZero();
            assertThat(stats.getNetPnl()).isEqualByComparingTo("0");
            assertThat(stats.getWinRate()).isEqualByComparingTo("0");
            assertThat(stats.getAvgPnl()).isEqualByComparingTo("0");
            assertThat(stats.getTotalTurnover()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Stats reflect closed trades")
        void statsAfterTrades() {
            paperManager.applyFill(OrderSide.BUY, 10, bd("100"), 1, T0);
            paperManager.applyFill(OrderSide.SELL, 5, bd("104"), 1, T0.plusSeconds(1));
            paperManager.applyFill(OrderSide.SELL, 5, bd("98"), 1, T0.plusSeconds(2));

            SessionStats stats = paperManager.getSessionStats();
            assertThat(stats.getTotalTrades()).isEqualTo(2);
            assertThat(stats.getWinningTrades()).isEqualTo(1);
            assertThat(stats.getLosingTrades()).isEqualTo(1);
            assertThat(stats.getWinRate()).isEqualByComparingTo("50.00");
            assertThat(stats.getNetPnl()).isEqualByComparingTo("10.00");
            assertThat(stats.getAvgPnl()).isEqualByComparingTo("5.00");
            // (100 + 104) * 5 + (100 + 98) * 5
            assertThat(stats.getTotalTurnover()).isEqualByComparingTo("2010.00");
        }

        @Test
        @DisplayName("Repeated snapshots without mutation are equal")
        void snapshotsAreIdempotent() {
            paperManager.applyFill(OrderSide.BUY, 2, bd("100"), 10, T0);
            paperManager.applyPriceTick(bd("101"));

            assertThat(paperManager.getPosition()).isEqualTo(paperManager.getPosition());
            assertThat(paperManager.getOrderHistory()).isEqualTo(paperManager.getOrderHistory());
            assertThat(paperManager.getSessionStats()).isEqualTo(paperManager.getSessionStats());
        }

        @Test
        @DisplayName("Returned position is a copy")
        void positionIsCopy() {
            paperManager.applyFill(OrderSide.BUY, 1, bd("100"), 10, T0);

            Position snapshot = paperManager.getPosition();
            snapshot.setQtyLots(99);

            assertThat(paperManager.getPosition().getQtyLots()).isEqualTo(1);
        }

        @Test
        @DisplayName("Recorded orders are kept in arrival order")
        void orderHistory() {
            Order first = Order.builder().side(OrderSide.BUY).quantity(1).orderId("PAPER000001").build();
            Order second = Order.builder().side(OrderSide.SELL).quantity(1).orderId("PAPER000002").build();

            paperManager.recordOrder(first);
            paperManager.recordOrder(second);

            assertThat(paperManager.getOrderHistory()).containsExactly(first, second);
            assertThat(paperManager.getPosition().getQtyUnits()).isZero();
        }
    }

    // ==============================
    // RESET
    // ==============================

    @Nested
    @DisplayName("Reset")
    class Reset {

        @Test
        @DisplayName("Paper reset keeps trade history and net P&L")
        void paperResetKeepsTrades() {
            paperManager.recordOrder(Order.builder().side(OrderSide.BUY).quantity(2).build());
            paperManager.applyFill(OrderSide.BUY, 2, bd("100"), 1, T0);
            paperManager.applyFill(OrderSide.SELL, 1, bd("110"), 1, T0.plusSeconds(1));

            paperManager.reset();

            assertThat(paperManager.getPosition()).isEqualTo(Position.flat());
            assertThat(paperManager.getOrderHistory()).isEmpty();
            assertThat(paperManager.getPendingLotCount()).isZero();
            assertThat(paperManager.getTradeHistory()).hasSize(1);
            assertThat(paperManager.getSessionNetPnl()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("Live reset clears everything")
        void liveResetClearsAll() {
            liveManager.recordOrder(Order.builder().side(OrderSide.BUY).quantity(1).build());
            liveManager.applyFill(OrderSide.BUY, 1, bd("100"), 1, T0);

            liveManager.reset();

            assertThat(liveManager.getPosition()).isEqualTo(Position.flat());
            assertThat(liveManager.getOrderHistory()).isEmpty();
            assertThat(liveManager.getTradeHistory()).isEmpty();
        }

        @Test
        @DisplayName("Cost basis starts over after reset")
        void costBasisAfterReset() {
            paperManager.applyFill(OrderSide.BUY, 1, bd("100"), 1, T0);
            paperManager.reset();
            paperManager.applyFill(OrderSide.BUY, 1, bd("50"), 1, T0.plusSeconds(1));

            assertThat(paperManager.getPosition().getAvgPrice()).isEqualByComparingTo("50");
        }
    }

    // ==============================
    // EXPORT
    // ==============================

    @Nested
    @DisplayName("Export")
    class Export {

        @Test
        @DisplayName("Nothing is written without trades")
        void emptyExport() {
            ExportResult result = paperManager.exportTrades();

            assertThat(result.getStatus()).isEqualTo(ExportResult.Status.NOTHING_TO_EXPORT);
            assertThat(result.getPathOrEmpty()).isEmpty();
            assertThat(Files.exists(tempDir.resolve("trades"))).isFalse();
        }

        @Test
        @DisplayName("Trades are exported to the requested file")
        void exportToFile() throws Exception {
            paperManager.applyFill(OrderSide.BUY, 10, bd("100"), 1, T0);
            paperManager.applyFill(OrderSide.SELL, 10, bd("101"), 1, T0.plusSeconds(1));
            Path file = tempDir.resolve("session.csv");

            ExportResult result = paperManager.exportTrades(file);

            assertThat(result.isExported()).isTrue();
            assertThat(result.getPath()).isEqualTo(file);
            assertThat(Files.readAllLines(file)).hasSize(2);
        }

        @Test
        @DisplayName("Default export creates the directory and a timestamped file")
        void defaultExport() {
            paperManager.applyFill(OrderSide.BUY, 1, bd("100"), 1, T0);
            paperManager.applyFill(OrderSide.SELL, 1, bd("101"), 1, T0.plusSeconds(1));

            ExportResult result = paperManager.exportTrades();

            assertThat(result.isExported()).isTrue();
            assertThat(result.getPath().getParent()).isEqualTo(tempDir.resolve("trades"));
            assertThat(result.getPath().getFileName().toString()).matches("paper_trades_\\d{8}_\\d{6}\\.csv");
        }
    }

    // ==============================
    // RECORD AND APPLY
    // ==============================

    @Nested
    @DisplayName("Recording Fills")
    class RecordingFills {

        @Test
        @DisplayName("Order and position change land together")
        void recordsAndApplies() {
            Order buy = Order.builder()
                    .timestamp(T0)
                    .side(OrderSide.BUY)
                    .quantity(2)
                    .price(bd("100"))
                    .orderId("PAPER000001")
                    .build();
            Order sell = Order.builder()
                    .timestamp(T0.plusSeconds(30))
                    .side(OrderSide.SELL)
                    .quantity(2)
                    .price(bd("104"))
                    .orderId("PAPER000002")
                    .build();

            paperManager.recordAndApplyFill(buy, 25);
            assertThat(paperManager.getOrderHistory()).containsExactly(buy);
            assertThat(paperManager.getPosition().getQtyUnits()).isEqualTo(50);

            Optional<Trade> closed = paperManager.recordAndApplyFill(sell, 25);

            assertThat(paperManager.getOrderHistory()).containsExactly(buy, sell);
            assertThat(paperManager.hasOpenPosition()).isFalse();
            assertThat(closed).isPresent();
            assertThat(closed.get().getEntryTime()).isEqualTo(T0);
            assertThat(closed.get().getDurationSeconds()).isEqualTo(30);
            assertThat(closed.get().getPnl()).isEqualByComparingTo("200");
        }

        @Test
        @DisplayName("Unit overflow fails before anything is recorded")
        void overflowRejected() {
            Order huge = Order.builder()
                    .timestamp(T0)
                    .side(OrderSide.BUY)
                    .quantity(Integer.MAX_VALUE)
                    .price(bd("100"))
                    .build();

            assertThatThrownBy(() -> paperManager.recordAndApplyFill(huge, 75))
                    .isInstanceOf(ArithmeticException.class);
            assertThatThrownBy(() -> paperManager.applyFill(OrderSide.BUY, Integer.MAX_VALUE, bd("100"), 75, T0))
                    .isInstanceOf(ArithmeticException.class);

            assertThat(paperManager.getOrderHistory()).isEmpty();
            assertThat(paperManager.getPosition()).isEqualTo(Position.flat());
            assertThat(paperManager.getPendingLotCount()).isZero();
        }
    }
}
