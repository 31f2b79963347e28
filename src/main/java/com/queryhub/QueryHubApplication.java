package com.queryhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * QueryHub query service
 *
 * Runs read-only analytical queries against each workspace's own analytics
 * backend (PostHog) on behalf of the dashboard, the embedded agent, MCP
 * clients and the billing cron.
 *
 * Architecture:
 * - REST API, non-blocking remote calls (WebClient + Reactor)
 * - Per-workspace rate limiting (in-memory or Redis)
 * - Workspace-scoped result cache (PostgreSQL or in-memory)
 * - Encrypted integration credentials, decrypted per call
 * - Count fallback through paginated enumeration
 * - Scheduled cache sweep and MTU tracking
 */
@SpringBootApplication
@EnableScheduling
public class QueryHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryHubApplication.class, args);
    }
}
