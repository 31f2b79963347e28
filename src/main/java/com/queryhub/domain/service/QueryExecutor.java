package com.queryhub.domain.service;

import com.queryhub.domain.error.InvalidQueryException;
import com.queryhub.domain.error.QueryException;
import com.queryhub.domain.error.QueryTimeoutException;
import com.queryhub.domain.error.UpstreamApiException;
import com.queryhub.domain.model.QueryResultSet;
import com.queryhub.domain.model.TableInfo;
import com.queryhub.domain.model.WorkspaceCredential;
import com.queryhub.infrastructure.engine.AnalyticsEngineClient;
import com.queryhub.infrastructure.engine.AnalyticsEngineClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;

/**
 * Runs queries against the remote analytics engine under a hard deadline.
 *
 * A missed deadline is a {@link QueryTimeoutException}; every other remote
 * failure is an {@link UpstreamApiException}. The two are never conflated.
 */
@Slf4j
@Service
public class QueryExecutor {

    /** Schema entry types that cannot be selected from directly. */
    static final Set<String> NON_QUERYABLE_TYPES = Set.of("lazy_table", "virtual_table", "field_traverser");

    static final String NATIVE_SOURCE_TYPE = "posthog";

    private final AnalyticsEngineClientFactory clientFactory;
    private final Clock clock;
    private final long defaultTimeoutMs;

    public QueryExecutor(AnalyticsEngineClientFactory clientFactory, Clock clock,
                         @Value("${app.query.timeout-ms:60000}") long defaultTimeoutMs) {
        this.clientFactory = clientFactory;
        this.clock = clock;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public Mono<QueryResultSet> run(WorkspaceCredential credential, String queryText) {
        return run(credential, queryText, defaultTimeoutMs);
    }

    public Mono<QueryResultSet> run(WorkspaceCredential credential, String queryText, Long timeoutMs) {
        if (queryText == null || queryText.isBlank()) {
            return Mono.error(new InvalidQueryException("query text is empty"));
        }
        long deadline = timeoutMs == null || timeoutMs <= 0 ? defaultTimeoutMs : Math.min(timeoutMs, defaultTimeoutMs);

        return Mono.defer(() -> {
            long start = clock.millis();
            return clientFactory.forCredential(credential)
                    .query(queryText)
                    .timeout(Duration.ofMillis(deadline))
                    .map(result -> QueryResultSet.builder()
                            .columns(result.getColumns())
                            .rows(result.getRows())
                            .rowCount(result.getRowCount())
                            .executionTimeMs(clock.millis() - start)
                            .build());
        })
                .onErrorMap(TimeoutException.class, e -> new QueryTimeoutException(deadline))
                .onErrorMap(e -> !(e instanceof QueryException), e -> {
                    log.warn("Query for workspace {} failed: {}", credential.getWorkspaceId(), e.getClass().getSimpleName());
                    return new UpstreamApiException("Analytics query failed", null, e);
                });
    }

    /**
     * Lists queryable tables by merging the warehouse registry over the live
     * schema. Either source may fail; the other one is still returned.
     */
    public Mono<List<TableInfo>> listTables(WorkspaceCredential credential) {
        String workspaceId = credential.getWorkspaceId();

        return Mono.defer(() -> {
            AnalyticsEngineClient client = clientFactory.forCredential(credential);

            Mono<List<TableInfo>> warehouse = client.warehouseTables()
                    .timeout(Duration.ofMillis(defaultTimeoutMs))
                    .onErrorResume(e -> {
                        log.warn("Warehouse table listing failed for workspace {}: {}", workspaceId, e.getMessage());
                        return Mono.just(Collections.emptyList());
                    });

            Mono<Map<String, String>> schema = client.schemaTables()
                    .timeout(Duration.ofMillis(defaultTimeoutMs))
                    .onErrorResume(e -> {
                        log.warn("Schema listing failed for workspace {}: {}", workspaceId, e.getMessage());
                        return Mono.just(Collections.emptyMap());
                    });

            return Mono.zip(warehouse, schema)
                    .map(sources -> merge(sources.getT1(), sources.getT2()));
        }).doOnNext(tables -> log.info("Listed {} tables for workspace {}", tables.size(), workspaceId));
    }

    static List<TableInfo> merge(List<TableInfo> warehouseTables, Map<String, String> schemaTables) {
        Map<String, TableInfo> byName = new TreeMap<>();

        schemaTables.forEach((name, type) -> {
            if (name != null && !NON_QUERYABLE_TYPES.contains(type)) {
                byName.put(name, TableInfo.builder().tableName(name).sourceType(NATIVE_SOURCE_TYPE).build());
            }
        });
        for (TableInfo table : warehouseTables) {
            byName.put(table.getTableName(), table);
        }
        return new ArrayList<>(byName.values());
    }
}
