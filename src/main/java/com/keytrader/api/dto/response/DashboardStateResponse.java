package com.keytrader.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.keytrader.observability.LogEntry;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything the dashboard polls for: instrument, position, fills, recent log lines and, in
 * paper mode, the session statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DashboardStateResponse {

    private InstrumentResponse instrument;
    private PositionResponse position;
    private List<OrderResponse> orderHistory;
    private List<LogEntry> logs;
    private Instant lastUpdate;
    private boolean paperMode;

    /** Present in paper mode only. */
    private SessionStatsResponse sessionStats;
}
