package com.keytrader.config;

import com.keytrader.broker.BrokerGateway;
import com.keytrader.broker.MarketDataProvider;
import com.keytrader.ledger.PositionManager;
import com.keytrader.oms.LiveOrderExecutor;
import com.keytrader.oms.OrderExecutor;
import com.keytrader.oms.OrderThrottle;
import com.keytrader.oms.PaperOrderExecutor;
import com.keytrader.oms.PaperOrderIdGenerator;
import com.keytrader.reporting.TradeCsvExporter;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the position ledger and the order executor for the configured trading mode.
 *
 * <p>LIVE mode needs a {@link BrokerGateway} bean from the deployment; startup fails without one.
 */
@Configuration
public class LedgerConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfig.class);

    @Bean
    public TradeCsvExporter tradeCsvExporter(TradingConfig tradingConfig) {
        return new TradeCsvExporter(Path.of(tradingConfig.getExportDirectory()));
    }

    @Bean
    public PositionManager positionManager(TradingConfig tradingConfig, TradeCsvExporter tradeCsvExporter) {
        return new PositionManager(tradingConfig.getMode().isSimulation(), tradeCsvExporter);
    }

    @Bean
    public OrderThrottle orderThrottle(TradingConfig tradingConfig) {
        return new OrderThrottle(tradingConfig.getMinOrderIntervalMs());
    }

    @Bean
    public OrderExecutor orderExecutor(
            TradingConfig tradingConfig,
            PositionManager positionManager,
            MarketDataProvider marketDataProvider,
            OrderThrottle orderThrottle,
            ObjectProvider<BrokerGateway> brokerGateway,
            ApplicationEventPublisher eventPublisher) {
        log.info("Trading mode: {}", tradingConfig.getMode());
        if (tradingConfig.getMode().isSimulation()) {
            return new PaperOrderExecutor(
                    positionManager, marketDataProvider, orderThrottle, new PaperOrderIdGenerator(), eventPublisher);
        }
        BrokerGateway gateway = brokerGateway.getIfAvailable();
        if (gateway == null) {
            throw new IllegalStateException(
                    "keytrader.trading.mode=LIVE requires a BrokerGateway bean; none is configured");
        }
        return new LiveOrderExecutor(
                positionManager, gateway, orderThrottle, eventPublisher, tradingConfig.getFillLookupDelayMs());
    }
}
