package com.keytrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Aggregate statistics over the closed trades of the session. Values are rounded to 2 places. */
@Value
@Builder
public class SessionStats {

    BigDecimal netPnl;
    int totalTrades;
    int winningTrades;
    int losingTrades;
    BigDecimal winRate;
    BigDecimal totalTurnover;
    BigDecimal avgPnl;

    public static SessionStats empty() {
        return SessionStats.builder()
                .netPnl(BigDecimal.ZERO)
                .totalTrades(0)
                .winningTrades(0)
                .losingTrades(0)
                .winRate(BigDecimal.ZERO)
                .totalTurnover(BigDecimal.ZERO)
                .avgPnl(BigDecimal.ZERO)
                .build();
    }
}
