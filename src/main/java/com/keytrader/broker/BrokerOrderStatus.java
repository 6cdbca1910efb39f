package com.keytrader.broker;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * An entry from the broker's order book.
 *
 * <p>Status codes follow the broker's numeric convention: 1 Cancelled, 2 Traded, 4 Transit,
 * 5 Rejected, 6 Pending, 7 Expired.
 */
@Value
@Builder
public class BrokerOrderStatus {

    private static final Map<Integer, String> STATUS_TEXT = Map.of(
            1, "Cancelled",
            2, "Traded",
            4, "Transit",
            5, "Rejected",
            6, "Pending",
            7, "Expired");

    String orderId;

    /** Filled quantity in units. */
    int filledQuantity;

    BigDecimal averagePrice;
    int statusCode;

    public String getStatusText() {
        return STATUS_TEXT.getOrDefault(statusCode, "Unknown");
    }

    public boolean isFilled() {
        return filledQuantity > 0 && averagePrice != null && averagePrice.signum() > 0;
    }
}
