package com.keytrader.oms;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sequential ids for simulated fills: PAPER000001, PAPER000002, ...
 *
 * <p>The counter lives for the process; it is not reset with the ledger, so ids stay unique
 * across instrument switches.
 */
public class PaperOrderIdGenerator {

    static final String PREFIX = "PAPER";

    private final AtomicInteger sequence = new AtomicInteger();

    public String next() {
        return String.format("%s%06d", PREFIX, sequence.incrementAndGet());
    }
}
