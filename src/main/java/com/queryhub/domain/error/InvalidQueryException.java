package com.queryhub.domain.error;

public class InvalidQueryException extends QueryException {

    private final String reason;

    public InvalidQueryException(String reason) {
        super(ErrorKind.INVALID_QUERY, "Invalid query: " + reason, false);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
