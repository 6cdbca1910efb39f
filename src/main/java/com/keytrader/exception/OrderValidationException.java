package com.keytrader.exception;

import java.util.Map;

/** An order command was rejected before reaching the broker or the ledger. */
public class OrderValidationException extends TradingException {

    public OrderValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public OrderValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.VALIDATION_ERROR, message, Map.of(field, String.valueOf(rejectedValue)));
    }
}
