package com.queryhub.domain.error;

/**
 * Per-workspace quota exhausted for the current window.
 */
public class RateLimitExceededException extends QueryException {

    private final String workspaceId;
    private final int limit;
    private final long retryAfterMs;

    public RateLimitExceededException(String workspaceId, int limit, long retryAfterMs) {
        super(ErrorKind.RATE_LIMITED,
                "Rate limit exceeded. Limit: " + limit + " requests per window.",
                true);
        this.workspaceId = workspaceId;
        this.limit = limit;
        this.retryAfterMs = retryAfterMs;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public int getLimit() {
        return limit;
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }

    /**
     * Whole seconds until the window resets, never less than one.
     */
    public long getRetryAfterSeconds() {
        return Math.max(1, (retryAfterMs + 999) / 1000);
    }
}
