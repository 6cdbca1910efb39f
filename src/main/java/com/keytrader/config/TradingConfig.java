package com.keytrader.config;

import com.keytrader.domain.enums.TradingMode;
import com.keytrader.domain.model.Instrument;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the trading session.
 *
 * <p>Properties prefix: {@code keytrader.trading.*}. The first configured instrument is the
 * one selected at startup.
 */
@Configuration
@ConfigurationProperties(prefix = "keytrader.trading")
@Validated
@Getter
@Setter
public class TradingConfig {

    /** PAPER simulates fills against the quote board; LIVE sends orders to the broker. */
    @NotNull
    private TradingMode mode = TradingMode.PAPER;

    /** Directory for CSV trade exports, created on first export. */
    private String exportDirectory = "trades";

    /** Interval between price polls for the selected instrument. */
    private long pricePollIntervalMs = 5000;

    /** Minimum time between two order submissions. */
    private long minOrderIntervalMs = 100;

    /** Wait between placing a live market order and reading its fill from the order book. */
    @PositiveOrZero
    private long fillLookupDelayMs = 500;

    /** Export the trade history when the application shuts down (paper mode only). */
    private boolean exportOnShutdown = true;

    @Valid
    @NotEmpty
    private List<Instrument> instruments = new ArrayList<>();
}
