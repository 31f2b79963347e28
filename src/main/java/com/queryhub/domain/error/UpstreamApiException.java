package com.queryhub.domain.error;

/**
 * The analytics engine answered with an application error, or could not be reached.
 *
 * {@code statusCode} is the upstream HTTP status, or {@code null} for transport failures.
 */
public class UpstreamApiException extends QueryException {

    private final Integer statusCode;

    public UpstreamApiException(String message, Integer statusCode) {
        this(message, statusCode, null);
    }

    public UpstreamApiException(String message, Integer statusCode, Throwable cause) {
        super(ErrorKind.UPSTREAM_API_ERROR, message, isRetryableStatus(statusCode), cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    private static boolean isRetryableStatus(Integer statusCode) {
        return statusCode == null || statusCode == 429 || statusCode >= 500;
    }
}
