package com.keytrader.domain.enums;

/**
 * Execution mode of the session. PAPER simulates fills against the quote board and
 * enables trade reconstruction in the ledger; LIVE sends orders to the broker.
 */
public enum TradingMode {
    PAPER,
    LIVE;

    public boolean isSimulation() {
        return this == PAPER;
    }
}
