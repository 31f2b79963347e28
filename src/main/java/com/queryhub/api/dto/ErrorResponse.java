package com.queryhub.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body shared by every endpoint.
 *
 * {
 *   "error": "rate_limited",
 *   "message": "...",
 *   "retry_after": 42,
 *   "trace_id": "..."
 * }
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorResponse {

    private String error;
    private String message;

    /** Seconds; only for rate_limited. */
    private Long retryAfter;

    private String traceId;
}
