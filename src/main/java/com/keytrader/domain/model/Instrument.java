package com.keytrader.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A tradeable instrument from the configuration, e.g. "NSE:NIFTY25OCTFUT" on NFO with lot size 75.
 *
 * <p>The lot size is fixed for the lifetime of a position on this instrument.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Instrument {

    public static final String DEFAULT_PRODUCT = "INTRADAY";

    @NotBlank(message = "symbol is required")
    private String symbol;

    @NotBlank(message = "exchange is required")
    private String exchange;

    @Positive(message = "lot size must be greater than 0")
    private int lotSize;

    /** Broker product type; INTRADAY when not configured. */
    @Builder.Default
    private String product = DEFAULT_PRODUCT;

    public String getProduct() {
        return product == null || product.isBlank() ? DEFAULT_PRODUCT : product;
    }
}
