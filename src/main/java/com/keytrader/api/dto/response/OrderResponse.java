package com.keytrader.api.dto.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {

    private LocalDateTime timestamp;
    private String side;

    /** Lots. */
    private int quantity;

    private BigDecimal price;
    private String orderId;
    private String status;
}
