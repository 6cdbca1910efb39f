package com.keytrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeInstrumentRequest {

    /** Symbol of a configured instrument, e.g. "NSE:NIFTY25OCTFUT". */
    @NotBlank(message = "symbol is required")
    private String symbol;
}
