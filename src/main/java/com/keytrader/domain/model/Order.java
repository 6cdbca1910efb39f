package com.keytrader.domain.model;

import com.keytrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One executed fill as reported by the paper simulator or the broker.
 *
 * <p>Quantity is expressed in lots, not units. Orders are append-only history entries;
 * they never influence the position by themselves (the executor applies the fill separately).
 */
@Value
@Builder
public class Order {

    LocalDateTime timestamp;
    OrderSide side;

    /** Filled quantity in lots. */
    int quantity;

    /** Average execution price. */
    BigDecimal price;

    /** Broker order id, or PAPERnnnnnn for simulated fills. */
    String orderId;

    /** Human readable status, e.g. "Traded" or "Paper Executed". */
    String status;
}
