package com.keytrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Error codes returned in the API error envelope, with the HTTP status each maps to. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR(400),
    BAD_REQUEST(400),
    INSTRUMENT_NOT_FOUND(404),
    POSITION_OPEN(409),
    NO_MARKET_PRICE(503),
    INTERNAL_ERROR(500),
    BROKER_ERROR(502);

    private final int httpStatus;

    public boolean isServerError() {
        return httpStatus >= 500;
    }
}
