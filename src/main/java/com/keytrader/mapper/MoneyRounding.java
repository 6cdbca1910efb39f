package com.keytrader.mapper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.mapstruct.Named;

/** Rounds money and percentages to 2 decimals for API responses; the ledger keeps full precision. */
public final class MoneyRounding {

    private MoneyRounding() {}

    @Named("money")
    public static BigDecimal round(BigDecimal value) {
        return value == null ? null : value.setScale(2, RoundingMode.HALF_UP);
    }
}
