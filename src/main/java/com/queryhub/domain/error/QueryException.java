package com.queryhub.domain.error;

/**
 * Base class for every failure the query service reports to callers.
 *
 * Messages are written for end users: they must never contain credential
 * material, upstream response bodies or stack traces.
 */
public abstract class QueryException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean retryable;

    protected QueryException(ErrorKind kind, String message, boolean retryable) {
        super(message);
        this.kind = kind;
        this.retryable = retryable;
    }

    protected QueryException(ErrorKind kind, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
