package com.keytrader.exception;

import java.util.Map;

/** Broker or market data failure while executing an order. */
public class BrokerException extends TradingException {

    public BrokerException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public BrokerException(ErrorCode errorCode, String symbol, String message) {
        super(errorCode, message, Map.of("symbol", symbol));
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, Map.of(), cause);
    }
}
