package com.keytrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Top-of-book update pushed by the upstream market data feed. Bid and ask are optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteUpdateRequest {

    @NotBlank(message = "symbol is required")
    private String symbol;

    @NotNull(message = "lastPrice is required")
    @PositiveOrZero
    private BigDecimal lastPrice;

    @PositiveOrZero
    private BigDecimal bestBid;

    @PositiveOrZero
    private BigDecimal bestAsk;
}
