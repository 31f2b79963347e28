package com.queryhub.api.web;

import com.queryhub.api.dto.ErrorResponse;
import com.queryhub.domain.error.ErrorKind;
import com.queryhub.domain.error.QueryException;
import com.queryhub.domain.error.RateLimitExceededException;
import lombok.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Maps failures to status, body and headers. Pure: no logging, no I/O.
 *
 * Bodies carry only the user-facing message of a known error kind; causes,
 * upstream bodies and stack traces never leave the service.
 */
@Component
public class ErrorResponseMapper {

    static final String GENERIC_MESSAGE = "An unexpected error occurred";

    @Value
    public static class MappedError {
        int status;
        ErrorResponse body;
        HttpHeaders headers;
    }

    public MappedError map(Throwable error, String traceId) {
        if (error instanceof QueryException) {
            return mapQueryException((QueryException) error, traceId);
        }
        if (error instanceof CallerAuthenticationException) {
            return new MappedError(401, body("unauthorized", error.getMessage(), null, traceId), new HttpHeaders());
        }
        return new MappedError(500, body("internal_error", GENERIC_MESSAGE, null, traceId), new HttpHeaders());
    }

    private MappedError mapQueryException(QueryException error, String traceId) {
        ErrorKind kind = error.getKind();
        HttpHeaders headers = new HttpHeaders();
        Long retryAfter = null;

        if (error instanceof RateLimitExceededException) {
            RateLimitExceededException limited = (RateLimitExceededException) error;
            retryAfter = limited.getRetryAfterSeconds();
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
            headers.set("X-RateLimit-Limit", String.valueOf(limited.getLimit()));
            headers.set("X-RateLimit-Remaining", "0");
        }

        return new MappedError(kind.getHttpStatus(),
                body(kind.getCode(), error.getMessage(), retryAfter, traceId), headers);
    }

    private static ErrorResponse body(String code, String message, Long retryAfter, String traceId) {
        return ErrorResponse.builder()
                .error(code)
                .message(message)
                .retryAfter(retryAfter)
                .traceId(traceId)
                .build();
    }
}
