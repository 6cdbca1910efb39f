package com.keytrader.api.dto.response;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Position snapshot for the dashboard, money rounded to 2 decimals. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionResponse {

    private int qtyLots;
    private int qtyUnits;
    private BigDecimal avgPrice;
    private BigDecimal cmp;
    private BigDecimal mtm;
    private BigDecimal mtmChangePercent;
    private BigDecimal totalValue;
}
