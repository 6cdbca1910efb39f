package com.keytrader.exception;

import java.util.Map;

/**
 * The command is valid but not allowed in the current session state, e.g. switching
 * instrument with an open position.
 */
public class TradingStateException extends TradingException {

    public TradingStateException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public TradingStateException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
