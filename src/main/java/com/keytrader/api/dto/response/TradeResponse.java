package com.keytrader.api.dto.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A closed trade with the same fields as a CSV export row. Quantities are units. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeResponse {

    private LocalDateTime entryTime;
    private BigDecimal entryPrice;
    private int entryQuantity;
    private LocalDateTime exitTime;
    private BigDecimal exitPrice;
    private int exitQuantity;
    private int quantity;
    private BigDecimal pnl;
    private BigDecimal pnlPercent;
    private long durationSeconds;
    private BigDecimal turnover;
}
