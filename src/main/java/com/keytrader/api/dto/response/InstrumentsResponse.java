package com.keytrader.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstrumentsResponse {

    private InstrumentResponse current;
    private List<InstrumentResponse> instruments;
}
