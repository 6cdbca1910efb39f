package com.keytrader.reporting;

import com.keytrader.domain.model.Trade;
import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the closed trade history as CSV.
 *
 * <p>Column order is fixed:
 * {@code entry_time,entry_price,entry_qty,exit_time,exit_price,exit_qty,qty,pnl,pnl_percent,duration_seconds,turnover}.
 * Timestamps use {@code yyyy-MM-dd HH:mm:ss}; prices, P&amp;L, percentages and turnover are
 * rounded HALF_UP to 2 decimals; rows end with CRLF.
 *
 * <p>The exporter never throws for I/O problems: failures come back as
 * {@link ExportResult#failed(String)} and are logged.
 */
public class TradeCsvExporter {

    private static final Logger log = LoggerFactory.getLogger(TradeCsvExporter.class);

    public static final String HEADER =
            "entry_time,entry_price,entry_qty,exit_time,exit_price,exit_qty,qty,pnl,pnl_percent,duration_seconds,turnover";

    static final String LINE_SEPARATOR = "\r\n";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter FILE_SUFFIX_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path exportDirectory;

    public TradeCsvExporter(Path exportDirectory) {
        this.exportDirectory = exportDirectory;
    }

    public Path getExportDirectory() {
        return exportDirectory;
    }

    /**
     * Exports to a timestamped file under the export directory, creating the directory if needed.
     */
    public ExportResult export(List<Trade> trades, LocalDateTime now) {
        if (trades.isEmpty()) {
            return ExportResult.nothingToExport();
        }
        try {
            Files.createDirectories(exportDirectory);
        } catch (IOException e) {
            log.error("Failed to create trades directory {}: {}", exportDirectory, e.getMessage(), e);
            return ExportResult.failed("Failed to create trades directory: " + e.getMessage());
        }
        return export(trades, defaultFile(now));
    }

    /**
     * Exports to the given file, replacing any existing content.
     */
    public ExportResult export(List<Trade> trades, Path file) {
        if (trades.isEmpty()) {
            return ExportResult.nothingToExport();
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            writer.write(LINE_SEPARATOR);
            for (Trade trade : trades) {
                writer.write(toRow(trade));
                writer.write(LINE_SEPARATOR);
            }
        } catch (IOException e) {
            log.error("Failed to export trades to {}: {}", file, e.getMessage(), e);
            return ExportResult.failed("Failed to export trades: " + e.getMessage());
        }
        log.info("Exported {} trades to {}", trades.size(), file);
        return ExportResult.exported(file);
    }

    Path defaultFile(LocalDateTime now) {
        return exportDirectory.resolve("paper_trades_" + FILE_SUFFIX_FORMAT.format(now) + ".csv");
    }

    static String toRow(Trade trade) {
        return String.join(
                ",",
                TIMESTAMP_FORMAT.format(trade.getEntryTime()),
                money(trade.getEntryPrice()),
                String.valueOf(trade.getEntryQuantity()),
                TIMESTAMP_FORMAT.format(trade.getExitTime()),
                money(trade.getExitPrice()),
                String.valueOf(trade.getExitQuantity()),
                String.valueOf(trade.getQuantity()),
                money(trade.getPnl()),
                money(trade.getPnlPercent()),
                String.valueOf(trade.getDurationSeconds()),
                money(trade.getTurnover()));
    }

    private static String money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
