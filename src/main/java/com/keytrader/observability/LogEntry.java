package com.keytrader.observability;

import java.time.LocalDateTime;
import lombok.Value;

/** One line of the dashboard log panel. */
@Value
public class LogEntry {

    LocalDateTime timestamp;
    String level;
    String message;
}
