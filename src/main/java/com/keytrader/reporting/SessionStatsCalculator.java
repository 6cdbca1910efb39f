package com.keytrader.reporting;

import com.keytrader.domain.model.SessionStats;
import com.keytrader.domain.model.Trade;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Derives session statistics from the closed trade history.
 *
 * <p>Win rate and average P&amp;L are zero when there are no trades. The net P&amp;L is the
 * engine's running accumulator rather than a re-sum of the history, so the average reflects
 * exactly what was booked as each trade closed.
 */
public final class SessionStatsCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int SCALE = 2;

    private SessionStatsCalculator() {}

    public static SessionStats calculate(List<Trade> trades, BigDecimal sessionNetPnl) {
        BigDecimal netPnl = sessionNetPnl != null ? sessionNetPnl : BigDecimal.ZERO;
        int totalTrades = trades.size();
        if (totalTrades == 0) {
            return SessionStats.builder()
                    .netPnl(round(netPnl))
                    .totalTrades(0)
                    .winningTrades(0)
                    .losingTrades(0)
                    .winRate(BigDecimal.ZERO)
                    .totalTurnover(BigDecimal.ZERO)
                    .avgPnl(BigDecimal.ZERO)
                    .build();
        }

        int winningTrades = (int) trades.stream().filter(Trade::isWinner).count();
        int losingTrades = (int) trades.stream().filter(Trade::isLoser).count();

        BigDecimal totalTurnover =
                trades.stream().map(Trade::getTurnover).reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal total = BigDecimal.valueOf(totalTrades);
        BigDecimal winRate = BigDecimal.valueOf(winningTrades)
                .multiply(HUNDRED)
                .divide(total, SCALE, RoundingMode.HALF_UP);
        BigDecimal avgPnl = netPnl.divide(total, SCALE, RoundingMode.HALF_UP);

        return SessionStats.builder()
                .netPnl(round(netPnl))
                .totalTrades(totalTrades)
                .winningTrades(winningTrades)
                .losingTrades(losingTrades)
                .winRate(winRate)
                .totalTurnover(round(totalTurnover))
                .avgPnl(avgPnl)
                .build();
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
