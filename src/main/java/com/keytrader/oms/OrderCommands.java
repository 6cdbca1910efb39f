package com.keytrader.oms;

import com.keytrader.domain.enums.OrderSide;
import com.keytrader.domain.model.Instrument;
import com.keytrader.exception.OrderValidationException;

/** Shared checks for incoming order commands. */
final class OrderCommands {

    private OrderCommands() {}

    static void validate(Instrument instrument, OrderSide side, int lots) {
        if (instrument == null) {
            throw new OrderValidationException("No instrument selected");
        }
        if (side == null) {
            throw new OrderValidationException("side", null, "Side must be 'BUY' or 'SELL'");
        }
        if (lots <= 0) {
            throw new OrderValidationException("lots", lots, "Lots must be greater than 0");
        }
    }
}
