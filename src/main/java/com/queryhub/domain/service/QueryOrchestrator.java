package com.queryhub.domain.service;

import com.queryhub.domain.error.RateLimitExceededException;
import com.queryhub.domain.model.CachedResult;
import com.queryhub.domain.model.CountResult;
import com.queryhub.domain.model.CredentialAccess;
import com.queryhub.domain.model.ExecutionResult;
import com.queryhub.domain.model.ExecutionStatus;
import com.queryhub.domain.model.IssuedBy;
import com.queryhub.domain.model.QueryOptions;
import com.queryhub.domain.model.QueryRequest;
import com.queryhub.domain.model.QueryResultSet;
import com.queryhub.domain.model.RateLimitDecision;
import com.queryhub.domain.model.RateLimitScope;
import com.queryhub.domain.model.TableInfo;
import com.queryhub.domain.model.WorkspaceCredential;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for every caller surface (dashboard, agent, MCP, billing).
 *
 * Execute flow:
 * 1. Validate query text (local, no I/O)
 * 2. Admit against the workspace's rate-limit window
 * 3. Look up the cache (unless skipped)
 * 4. Resolve and decrypt the workspace credential
 * 5. Run the query, or count with enumeration fallback
 * 6. Cache completed results and record history
 *
 * Steps 1-4 touch blocking stores and run on the bounded elastic scheduler.
 * Partial counts are returned but never cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryOrchestrator {

    private final QueryValidator validator;
    private final RateLimiter rateLimiter;
    private final QueryCache queryCache;
    private final CredentialStore credentialStore;
    private final QueryExecutor executor;
    private final FallbackAggregator fallbackAggregator;
    private final QueryHistoryRecorder historyRecorder;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public Mono<ExecutionResult> execute(QueryRequest request, QueryOptions options) {
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(meterRegistry);
            String workspaceId = request.getWorkspaceId();

            validator.validate(request.getQueryText());

            RateLimitDecision decision = admit(workspaceId, options.getRateLimitScope());
            String queryHash = QueryHasher.hash(request.getQueryText());

            if (!options.isSkipCache()) {
                long lookupStart = clock.millis();
                Optional<CachedResult> cached = queryCache.get(workspaceId, queryHash);
                if (cached.isPresent()) {
                    long lookupMs = clock.millis() - lookupStart;
                    recordCache("hit");
                    sample.stop(latencyTimer(true));
                    log.debug("Cache hit for workspace {}: {}", workspaceId, QueryHasher.preview(request.getQueryText()));
                    return Mono.just(fromCache(cached.get(), decision, lookupMs));
                }
                recordCache("miss");
            }

            WorkspaceCredential credential = credentialStore.resolve(
                    CredentialAccess.forCaller(workspaceId, request.getIssuedBy()),
                    options.getIntegrationName());

            String queryId = historyRecorder.start(workspaceId, queryHash, request.getIssuedBy());
            return runRemote(request, options, credential, queryHash, queryId, decision, sample);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Lists queryable tables under the SCHEMA quota.
     */
    public Mono<List<TableInfo>> listTables(String workspaceId, IssuedBy issuedBy, String integrationName) {
        return Mono.defer(() -> {
            admit(workspaceId, RateLimitScope.SCHEMA);
            WorkspaceCredential credential = credentialStore.resolve(
                    CredentialAccess.forCaller(workspaceId, issuedBy), integrationName);
            return executor.listTables(credential);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private RateLimitDecision admit(String workspaceId, RateLimitScope scope) {
        RateLimitDecision decision = rateLimiter.admit(workspaceId, scope);
        if (!decision.isAllowed()) {
            throw new RateLimitExceededException(workspaceId, decision.getLimit(), decision.getRetryAfterMs());
        }
        return decision;
    }

    private Mono<ExecutionResult> runRemote(QueryRequest request, QueryOptions options, WorkspaceCredential credential,
                                            String queryHash, String queryId, RateLimitDecision decision,
                                            Timer.Sample sample) {
        String workspaceId = request.getWorkspaceId();
        long start = clock.millis();

        Mono<QueryResultSet> work;
        if (options.getCountFallback() == null) {
            work = executor.run(credential, request.getQueryText(), request.getTimeoutMs());
        } else {
            String countColumn = options.getCountFallback().getCountColumn();
            work = fallbackAggregator.countMatching(credential, request.getQueryText(), options.getCountFallback())
                    .map(count -> toResultSet(count, countColumn, clock.millis() - start));
        }

        return work
                .publishOn(Schedulers.boundedElastic())
                .map(result -> {
                    if (result.getStatus() == ExecutionStatus.COMPLETED) {
                        queryCache.put(workspaceId, queryHash, queryId, result, options.getCacheTtl());
                    }
                    historyRecorder.complete(queryId, result.getStatus(), result.getRowCount());

                    Counter.builder("query.executed")
                            .tag("result", "success")
                            .register(meterRegistry)
                            .increment();
                    sample.stop(latencyTimer(false));

                    log.info("Query executed: workspace={}, {} rows, {} ms, status={}, query='{}'",
                            workspaceId, result.getRowCount(), result.getExecutionTimeMs(),
                            result.getStatus().getValue(), QueryHasher.preview(request.getQueryText()));

                    return ExecutionResult.builder()
                            .queryId(queryId)
                            .status(result.getStatus())
                            .columns(result.getColumns())
                            .rows(result.getRows())
                            .rowCount(result.getRowCount())
                            .executionTimeMs(result.getExecutionTimeMs())
                            .cached(false)
                            .rateLimitRemaining(decision.getRemaining())
                            .rateLimitLimit(decision.getLimit())
                            .countSource(result.getCountSource())
                            .build();
                })
                .onErrorResume(e -> Mono.<Void>fromRunnable(() -> {
                            historyRecorder.fail(queryId, e);
                            Counter.builder("query.executed")
                                    .tag("result", "error")
                                    .register(meterRegistry)
                                    .increment();
                            log.warn("Query failed: workspace={}, error={}, query='{}'",
                                    workspaceId, e.getMessage(), QueryHasher.preview(request.getQueryText()));
                        })
                        .subscribeOn(Schedulers.boundedElastic())
                        .then(Mono.<ExecutionResult>error(e)));
    }

    private ExecutionResult fromCache(CachedResult cached, RateLimitDecision decision, long lookupMs) {
        return ExecutionResult.builder()
                .queryId(cached.getQueryId())
                .status(ExecutionStatus.COMPLETED)
                .columns(cached.getColumns())
                .rows(cached.getRows())
                .rowCount(cached.getRowCount())
                .executionTimeMs(lookupMs)
                .cached(true)
                .rateLimitRemaining(decision.getRemaining())
                .rateLimitLimit(decision.getLimit())
                .build();
    }

    private static QueryResultSet toResultSet(CountResult count, String countColumn, long elapsedMs) {
        List<Object> row = Collections.singletonList(count.getCount());
        return QueryResultSet.builder()
                .columns(Collections.singletonList(countColumn))
                .rows(Collections.singletonList(row))
                .rowCount(1)
                .executionTimeMs(elapsedMs)
                .status(count.isPartial() ? ExecutionStatus.PARTIAL : ExecutionStatus.COMPLETED)
                .countSource(count.getSource())
                .build();
    }

    private void recordCache(String result) {
        Counter.builder("query.cache")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private Timer latencyTimer(boolean cached) {
        return Timer.builder("query.latency")
                .tag("cached", String.valueOf(cached))
                .register(meterRegistry);
    }
}
