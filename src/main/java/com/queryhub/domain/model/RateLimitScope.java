package com.queryhub.domain.model;

/**
 * Call-site groups that carry their own per-workspace quota.
 */
public enum RateLimitScope {
    /** Ad-hoc query execution from dashboard, agent and MCP callers. */
    QUERY,
    /** Table/schema listing. */
    SCHEMA,
    /** Countable aggregates that may fall back to slow enumeration (MTU). */
    COUNT
}
