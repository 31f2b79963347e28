package com.queryhub.domain.error;

/**
 * The analytics engine did not answer within the executor deadline.
 */
public class QueryTimeoutException extends QueryException {

    private final long timeoutMs;

    public QueryTimeoutException(long timeoutMs) {
        super(ErrorKind.TIMEOUT, "Query execution timed out after " + timeoutMs + "ms", true);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
