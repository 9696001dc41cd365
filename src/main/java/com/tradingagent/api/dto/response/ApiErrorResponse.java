package com.tradingagent.api.dto.response;

import com.tradingagent.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body of the agent's control API. Successful calls are wrapped by
 * {@code ApiResponseAdvice} instead; this body is only written by
 * {@code GlobalExceptionHandler}.
 *
 * <p>{@code details} is omitted when empty. For a refused start it carries the recovery
 * error, for an illegal transition the state and trigger.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(
            ErrorCode errorCode, String message, Map<String, Object> details, String path, Instant timestamp) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .timestamp(timestamp)
                .path(path)
                .build());
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final int status;
        private final String message;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
    }
}
