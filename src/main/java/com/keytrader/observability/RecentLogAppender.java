package com.keytrader.observability;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/** Logback appender that copies formatted events into {@link RecentLogBuffer#shared()}. */
public class RecentLogAppender extends AppenderBase<ILoggingEvent> {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final RecentLogBuffer buffer;

    public RecentLogAppender() {
        this(RecentLogBuffer.shared());
    }

    public RecentLogAppender(RecentLogBuffer buffer) {
        this.buffer = buffer;
    }

    @Override
    protected void append(ILoggingEvent event) {
        LocalDateTime timestamp = LocalDateTime.ofInstant(Instant.ofEpochMilli(event.getTimeStamp()), IST);
        buffer.add(new LogEntry(timestamp, event.getLevel().toString(), event.getFormattedMessage()));
    }
}
