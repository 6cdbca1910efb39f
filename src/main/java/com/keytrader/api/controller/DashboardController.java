package com.keytrader.api.controller;

import com.keytrader.api.dto.response.DashboardStateResponse;
import com.keytrader.api.dto.response.ExportResponse;
import com.keytrader.api.dto.response.TradesResponse;
import com.keytrader.ledger.PositionManager;
import com.keytrader.mapper.InstrumentMapper;
import com.keytrader.mapper.OrderMapper;
import com.keytrader.mapper.PositionMapper;
import com.keytrader.mapper.SessionStatsMapper;
import com.keytrader.mapper.TradeMapper;
import com.keytrader.observability.RecentLogBuffer;
import com.keytrader.reporting.ExportResult;
import com.keytrader.session.TradingSession;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read side of the dashboard.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/state -- instrument, position, fills, recent logs, stats (paper mode)</li>
 *   <li>GET /api/trades -- closed trades and stats (paper mode)</li>
 *   <li>POST /api/trades/export -- write the trade history to CSV</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class DashboardController {

    private static final Logger log = LoggerFactory.getLogger(DashboardController.class);

    private final PositionManager positionManager;
    private final TradingSession tradingSession;
    private final RecentLogBuffer recentLogBuffer;
    private final PositionMapper positionMapper;
    private final OrderMapper orderMapper;
    private final TradeMapper tradeMapper;
    private final SessionStatsMapper sessionStatsMapper;
    private final InstrumentMapper instrumentMapper;

    public DashboardController(
            PositionManager positionManager,
            TradingSession tradingSession,
            RecentLogBuffer recentLogBuffer,
            PositionMapper positionMapper,
            OrderMapper orderMapper,
            TradeMapper tradeMapper,
            SessionStatsMapper sessionStatsMapper,
            InstrumentMapper instrumentMapper) {
        this.positionManager = positionManager;
        this.tradingSession = tradingSession;
        this.recentLogBuffer = recentLogBuffer;
        this.positionMapper = positionMapper;
        this.orderMapper = orderMapper;
        this.tradeMapper = tradeMapper;
        this.sessionStatsMapper = sessionStatsMapper;
        this.instrumentMapper = instrumentMapper;
    }

    @GetMapping("/state")
    public ResponseEntity<DashboardStateResponse> getState() {
        boolean paperMode = positionManager.isSimulationMode();
        DashboardStateResponse state = DashboardStateResponse.builder()
                .instrument(instrumentMapper.toResponse(tradingSession.getCurrentInstrument()))
                .position(positionMapper.toResponse(positionManager.getPosition()))
                .orderHistory(orderMapper.toResponseList(positionManager.getOrderHistory()))
                .logs(recentLogBuffer.getEntries())
                .lastUpdate(Instant.now())
                .paperMode(paperMode)
                .sessionStats(paperMode ? sessionStatsMapper.toResponse(positionManager.getSessionStats()) : null)
                .build();
        return ResponseEntity.ok(state);
    }

    @GetMapping("/trades")
    public ResponseEntity<TradesResponse> getTrades() {
        TradesResponse response = TradesResponse.builder()
                .trades(tradeMapper.toResponseList(positionManager.getTradeHistory()))
                .stats(
                        positionManager.isSimulationMode()
                                ? sessionStatsMapper.toResponse(positionManager.getSessionStats())
                                : null)
                .build();
        return ResponseEntity.ok(response);
    }

    /** A failed or empty export is reported in the body, not as an HTTP error. */
    @PostMapping("/trades/export")
    public ResponseEntity<ExportResponse> exportTrades() {
        ExportResult result = positionManager.exportTrades();
        log.info("Export requested: {}", result.getMessage());
        return ResponseEntity.ok(ExportResponse.builder()
                .status(result.getStatus().name())
                .path(result.getPathOrEmpty())
                .message(result.getMessage())
                .build());
    }
}
