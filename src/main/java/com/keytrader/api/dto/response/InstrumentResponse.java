package com.keytrader.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstrumentResponse {

    private String symbol;
    private String exchange;
    private String product;
    private int lotSize;
}
