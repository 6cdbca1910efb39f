package com.keytrader.domain.enums;

/** Buy or sell side of a fill. */
public enum OrderSide {
    BUY,
    SELL;

    /**
     * Parses a side name case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not BUY or SELL
     */
    public static OrderSide parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Side must be 'BUY' or 'SELL'");
        }
        String normalized = name.trim().toUpperCase();
        if ("BUY".equals(normalized)) {
            return BUY;
        }
        if ("SELL".equals(normalized)) {
            return SELL;
        }
        throw new IllegalArgumentException("Side must be 'BUY' or 'SELL'");
    }
}
