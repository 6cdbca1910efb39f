package com.keytrader.observability;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory list of the most recent log entries, oldest first.
 *
 * <p>Logback creates its appenders before the Spring context exists, so the appender and the
 * dashboard share the process-wide instance from {@link #shared()}.
 */
public class RecentLogBuffer {

    public static final int DEFAULT_CAPACITY = 1000;

    private static final RecentLogBuffer SHARED = new RecentLogBuffer(DEFAULT_CAPACITY);

    private final int capacity;
    private final Deque<LogEntry> entries = new ArrayDeque<>();

    public RecentLogBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public static RecentLogBuffer shared() {
        return SHARED;
    }

    public synchronized void add(LogEntry entry) {
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    public synchronized List<LogEntry> getEntries() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
