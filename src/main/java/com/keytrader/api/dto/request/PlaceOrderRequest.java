package com.keytrader.api.dto.request;

import com.keytrader.domain.enums.OrderSide;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Market order for the current instrument. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderRequest {

    @NotNull(message = "side is required")
    private OrderSide side;

    @NotNull(message = "lots is required")
    @Positive(message = "lots must be greater than 0")
    private Integer lots;
}
