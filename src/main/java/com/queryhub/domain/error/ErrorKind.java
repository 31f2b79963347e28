package com.queryhub.domain.error;

/**
 * Closed set of failure kinds surfaced to callers.
 *
 * Each kind has a stable machine-readable code and HTTP status.
 */
public enum ErrorKind {

    CONFIGURATION_ERROR("configuration_error", 400),
    INVALID_QUERY("invalid_query", 400),
    RATE_LIMITED("rate_limited", 429),
    TIMEOUT("timeout", 504),
    UPSTREAM_API_ERROR("upstream_api_error", 502),
    NOT_FOUND("not_found", 404);

    private final String code;
    private final int httpStatus;

    ErrorKind(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
