package com.keytrader.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/** Common tags for every meter, custom ones from TradingMetricsService included. */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final TradingConfig tradingConfig;

    public MetricsConfig(MeterRegistry meterRegistry, TradingConfig tradingConfig) {
        this.meterRegistry = meterRegistry;
        this.tradingConfig = tradingConfig;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "keytrader", "mode", tradingConfig.getMode().name());
    }
}
