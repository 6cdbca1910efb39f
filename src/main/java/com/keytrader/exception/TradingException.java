package com.keytrader.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Base of all expected failures raised outside the ledger. Carries the {@link ErrorCode}
 * used by {@link GlobalExceptionHandler} and optional structured details.
 */
@Getter
public abstract class TradingException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected TradingException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected TradingException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected TradingException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }
}
