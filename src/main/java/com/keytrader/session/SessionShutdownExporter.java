package com.keytrader.session;

import com.keytrader.config.TradingConfig;
import com.keytrader.ledger.PositionManager;
import com.keytrader.reporting.ExportResult;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Writes the paper session's trades to CSV when the application context closes.
 *
 * <p>Runs as a {@link SmartLifecycle} in an early shutdown phase, while the scheduler and web
 * layer are still up, so the export sees the final ledger state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionShutdownExporter implements SmartLifecycle {

    private final PositionManager positionManager;
    private final TradingConfig tradingConfig;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Override
    public void start() {
        running.set(true);
    }

    @Override
    public void stop() {
        try {
            exportOnShutdown();
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }

    public void exportOnShutdown() {
        log.info("Received shutdown signal");
        if (!positionManager.isSimulationMode() || !tradingConfig.isExportOnShutdown()) {
            return;
        }
        ExportResult result = positionManager.exportTrades();
        switch (result.getStatus()) {
            case EXPORTED -> log.info("Trades exported: {}", result.getPath());
            case FAILED -> log.error("Failed to export trades: {}", result.getMessage());
            default -> log.debug(result.getMessage());
        }
    }
}
