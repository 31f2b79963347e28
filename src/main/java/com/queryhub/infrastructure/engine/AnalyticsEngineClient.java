package com.queryhub.infrastructure.engine;

import com.queryhub.domain.model.EnumerationPage;
import com.queryhub.domain.model.QueryResultSet;
import com.queryhub.domain.model.TableInfo;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Remote analytics engine bound to one workspace credential.
 *
 * Failures are signalled as {@code UpstreamApiException}; callers apply their
 * own deadlines.
 */
public interface AnalyticsEngineClient {

    /**
     * Executes a HogQL query. {@code executionTimeMs} of the result is left at 0.
     */
    Mono<QueryResultSet> query(String queryText);

    /**
     * One page of the persons enumeration. {@code cursor} is null for the first page.
     */
    Mono<EnumerationPage> persons(String cursor, int pageSize);

    /**
     * Data-warehouse table registry, with source metadata.
     */
    Mono<List<TableInfo>> warehouseTables();

    /**
     * Live schema listing: table name to table type.
     */
    Mono<Map<String, String>> schemaTables();
}
