package com.queryhub.domain.model;

/**
 * Who issued a query. Determines the credential access mode.
 */
public enum IssuedBy {
    /** Human user authenticated by a browser session. */
    USER,
    /** Embedded agent authenticated by the shared agent secret. */
    AGENT,
    /** Machine client (MCP tool surface, billing cron). */
    MACHINE
}
