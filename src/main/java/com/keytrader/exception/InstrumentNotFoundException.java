package com.keytrader.exception;

import java.util.Map;

public class InstrumentNotFoundException extends TradingException {

    public InstrumentNotFoundException(String symbol) {
        super(ErrorCode.INSTRUMENT_NOT_FOUND, "Instrument not configured: " + symbol, Map.of("symbol", symbol));
    }
}
