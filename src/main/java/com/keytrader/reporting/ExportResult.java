package com.keytrader.reporting;

import java.nio.file.Path;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a trade export. Separates "nothing to export" from "export failed",
 * which share the empty path.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExportResult {

    public enum Status {
        EXPORTED,
        NOTHING_TO_EXPORT,
        FAILED
    }

    Status status;
    Path path;
    String message;

    public static ExportResult exported(Path path) {
        return new ExportResult(Status.EXPORTED, path, "Trades exported to " + path);
    }

    public static ExportResult nothingToExport() {
        return new ExportResult(Status.NOTHING_TO_EXPORT, null, "No trades to export");
    }

    public static ExportResult failed(String message) {
        return new ExportResult(Status.FAILED, null, message);
    }

    public boolean isExported() {
        return status == Status.EXPORTED;
    }

    /** The written file path, or an empty string when nothing was written. */
    public String getPathOrEmpty() {
        return path != null ? path.toString() : "";
    }
}
