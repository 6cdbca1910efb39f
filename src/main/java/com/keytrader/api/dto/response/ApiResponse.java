package com.keytrader.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.keytrader.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Envelope for every JSON response: {@code {success, data, timestamp}} on success,
 * {@code {success: false, error: {...}, timestamp}} on failure.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final ErrorBody error;
    private final Instant timestamp;

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, null, Instant.now());
    }

    public static ApiResponse<Void> error(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        ErrorBody body = ErrorBody.builder()
                .code(errorCode.name())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .path(path)
                .build();
        return new ApiResponse<>(false, null, body, Instant.now());
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorBody {
        private final String code;
        private final String message;
        private final Map<String, Object> details;
        private final String path;
    }
}
