package com.queryhub.infrastructure.engine;

import com.queryhub.domain.error.UpstreamApiException;
import com.queryhub.domain.model.EnumerationPage;
import com.queryhub.domain.model.QueryResultSet;
import com.queryhub.domain.model.TableInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PostHog implementation of {@link AnalyticsEngineClient}.
 *
 * Requests go to {@code <host>/api/projects/<projectId>} with the workspace API
 * key as bearer token. Upstream bodies are never copied into exception messages.
 */
@Slf4j
public class PostHogEngineClient implements AnalyticsEngineClient {

    private final WebClient webClient;
    private final String host;
    private final String projectId;

    public PostHogEngineClient(WebClient.Builder builder, String host, String projectId, String apiKey) {
        this.host = stripTrailingSlash(host);
        this.projectId = projectId;
        this.webClient = builder
                .baseUrl(this.host + "/api/projects/" + projectId)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public Mono<QueryResultSet> query(String queryText) {
        Map<String, Object> body = Map.of("query", Map.of("kind", "HogQLQuery", "query", queryText));

        return webClient.post()
                .uri("/query/")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(PostHogApi.HogQlResult.class)
                .map(PostHogEngineClient::toResultSet)
                .onErrorMap(this::isTransportError, e -> toUpstream("query", e));
    }

    @Override
    public Mono<EnumerationPage> persons(String cursor, int pageSize) {
        WebClient.RequestHeadersSpec<?> request;
        if (cursor != null && cursor.startsWith("http")) {
            if (!cursor.startsWith(host + "/")) {
                return Mono.error(new UpstreamApiException("Pagination cursor points outside the analytics host", null));
            }
            request = webClient.get().uri(URI.create(cursor));
        } else {
            request = webClient.get().uri(uri -> {
                uri.path("/persons/").queryParam("limit", pageSize);
                if (cursor != null && !cursor.isBlank()) {
                    uri.queryParam("cursor", cursor);
                }
                return uri.build();
            });
        }

        return request.retrieve()
                .bodyToMono(PostHogApi.PersonsPage.class)
                .map(page -> new EnumerationPage(
                        page.getResults() == null ? Collections.emptyList() : page.getResults(),
                        page.getNext()))
                .onErrorMap(this::isTransportError, e -> toUpstream("persons", e));
    }

    @Override
    public Mono<List<TableInfo>> warehouseTables() {
        return webClient.get()
                .uri("/warehouse_tables/")
                .retrieve()
                .bodyToMono(PostHogApi.WarehouseTables.class)
                .map(PostHogEngineClient::toTables)
                .onErrorMap(this::isTransportError, e -> toUpstream("warehouse_tables", e));
    }

    @Override
    public Mono<Map<String, String>> schemaTables() {
        Map<String, Object> body = Map.of("query", Map.of("kind", "DatabaseSchemaQuery"));

        return webClient.post()
                .uri("/query/")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(PostHogApi.DatabaseSchema.class)
                .map(schema -> {
                    Map<String, String> types = new LinkedHashMap<>();
                    if (schema.getTables() != null) {
                        schema.getTables().forEach((name, table) ->
                                types.put(name, table == null ? null : table.getType()));
                    }
                    return types;
                })
                .onErrorMap(this::isTransportError, e -> toUpstream("schema", e));
    }

    private boolean isTransportError(Throwable e) {
        return e instanceof WebClientResponseException || e instanceof WebClientRequestException;
    }

    private UpstreamApiException toUpstream(String operation, Throwable e) {
        if (e instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) e).getStatusCode().value();
            log.warn("Analytics engine {} call for project {} failed with HTTP {}", operation, projectId, status);
            return new UpstreamApiException(describe(status), status, e);
        }
        log.warn("Analytics engine {} call for project {} failed: {}", operation, projectId, e.getClass().getSimpleName());
        return new UpstreamApiException("Analytics engine is unreachable", null, e);
    }

    private static String describe(int status) {
        if (status == 401 || status == 403) {
            return "Analytics engine rejected the API key";
        }
        if (status == 429) {
            return "Analytics engine rate limit exceeded";
        }
        return "Analytics engine request failed with status " + status;
    }

    private static QueryResultSet toResultSet(PostHogApi.HogQlResult result) {
        List<String> columns = result.getColumns() == null ? Collections.emptyList() : result.getColumns();
        List<List<Object>> rows = result.getResults() == null ? Collections.emptyList() : result.getResults();
        return QueryResultSet.builder()
                .columns(columns)
                .rows(rows)
                .rowCount(rows.size())
                .build();
    }

    private static List<TableInfo> toTables(PostHogApi.WarehouseTables body) {
        List<TableInfo> tables = new ArrayList<>();
        if (body.getResults() == null) {
            return tables;
        }
        for (PostHogApi.WarehouseTable table : body.getResults()) {
            if (table.getName() == null) {
                continue;
            }
            String sourceType = table.getExternalDataSource() == null
                    ? null
                    : table.getExternalDataSource().getSourceType();
            tables.add(TableInfo.builder().tableName(table.getName()).sourceType(sourceType).build());
        }
        return tables;
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
