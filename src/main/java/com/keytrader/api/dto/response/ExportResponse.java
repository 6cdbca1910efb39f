package com.keytrader.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportResponse {

    /** EXPORTED, NOTHING_TO_EXPORT or FAILED. */
    private String status;

    /** Written file, empty when nothing was written. */
    private String path;

    private String message;
}
