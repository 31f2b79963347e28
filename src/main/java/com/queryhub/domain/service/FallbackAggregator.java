package com.queryhub.domain.service;

import com.queryhub.domain.error.QueryException;
import com.queryhub.domain.model.CountFallback;
import com.queryhub.domain.model.CountResult;
import com.queryhub.domain.model.CountSource;
import com.queryhub.domain.model.EnumerationPage;
import com.queryhub.domain.model.QueryResultSet;
import com.queryhub.domain.model.WorkspaceCredential;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Counts matching items with a single aggregate query, falling back to paging
 * through an enumeration endpoint when the aggregate gives no usable answer.
 *
 * Fallback caps:
 * - max pages and page size
 * - wall-clock budget, measured from the start of the fallback and checked
 *   before each additional page
 * - bounded retry per page
 *
 * Hitting a cap with pages left yields {@code FALLBACK_PARTIAL}, including a
 * budget that runs out while a page is in flight. A page that keeps failing
 * after at least one page succeeded also yields a partial count, even when
 * that count is zero. Only a failure of the very first page propagates.
 */
@Slf4j
@Service
public class FallbackAggregator {

    private final QueryExecutor executor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final int maxPages;
    private final int pageSize;
    private final long wallClockBudgetMs;
    private final int pageRetries;
    private final long pageRetryDelayMs;

    public FallbackAggregator(
            QueryExecutor executor,
            Clock clock,
            MeterRegistry meterRegistry,
            @Value("${app.fallback.max-pages:100}") int maxPages,
            @Value("${app.fallback.page-size:100}") int pageSize,
            @Value("${app.fallback.wall-clock-budget-ms:50000}") long wallClockBudgetMs,
            @Value("${app.fallback.page-retries:1}") int pageRetries,
            @Value("${app.fallback.page-retry-delay-ms:500}") long pageRetryDelayMs) {
        this.executor = executor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.maxPages = maxPages;
        this.pageSize = pageSize;
        this.wallClockBudgetMs = wallClockBudgetMs;
        this.pageRetries = pageRetries;
        this.pageRetryDelayMs = pageRetryDelayMs;
    }

    public Mono<CountResult> countMatching(WorkspaceCredential credential, String countQuery, CountFallback fallback) {
        String workspaceId = credential.getWorkspaceId();

        return executor.run(credential, countQuery)
                .map(result -> extractCount(result, fallback.getCountColumn()))
                .onErrorResume(e -> {
                    log.warn("Aggregate count failed for workspace {} ({}), falling back to enumeration",
                            workspaceId, e.getMessage());
                    return Mono.just(Optional.<Long>empty());
                })
                .flatMap(count -> count.isPresent()
                        ? Mono.just(CountResult.primary(count.get()))
                        : enumerate(credential, fallback))
                .doOnNext(result -> Counter.builder("fallback.count")
                        .tag("source", result.getSource().name().toLowerCase(Locale.ROOT))
                        .register(meterRegistry)
                        .increment());
    }

    private Mono<CountResult> enumerate(WorkspaceCredential credential, CountFallback fallback) {
        if (fallback.getSource() == null) {
            return Mono.error(new IllegalStateException("Count fallback has no enumeration source"));
        }
        return Mono.defer(() -> {
            Run run = new Run(credential, fallback, clock.millis());
            return nextPage(run, null, 0L, 0);
        });
    }

    private Mono<CountResult> nextPage(Run run, String cursor, long countSoFar, int pagesFetched) {
        return fetch(run, cursor)
                .onErrorResume(e -> {
                    if (e instanceof TimeoutException) {
                        log.warn("Enumeration hit time budget ({} ms) on page {} for workspace {}, partial count {}",
                                wallClockBudgetMs, pagesFetched + 1, run.credential.getWorkspaceId(), countSoFar);
                        return Mono.empty();
                    }
                    if (pagesFetched == 0) {
                        return Mono.error(e);
                    }
                    log.warn("Enumeration page {} failed for workspace {} after {} matches, returning partial count: {}",
                            pagesFetched + 1, run.credential.getWorkspaceId(), countSoFar, e.getMessage());
                    return Mono.empty();
                })
                .flatMap(page -> {
                    long count = countSoFar + countMatches(page.getItems(), run.fallback.getPredicate());
                    int pages = pagesFetched + 1;

                    if (!page.hasMore()) {
                        log.info("Enumeration complete for workspace {}: {} matches in {} pages",
                                run.credential.getWorkspaceId(), count, pages);
                        return Mono.just(new CountResult(count, CountSource.FALLBACK_COMPLETE, pages));
                    }
                    if (pages >= maxPages) {
                        log.warn("Enumeration hit page cap ({}) for workspace {}, partial count {}",
                                maxPages, run.credential.getWorkspaceId(), count);
                        return Mono.just(partial(count, pages));
                    }
                    if (run.elapsedMs(clock) >= wallClockBudgetMs) {
                        log.warn("Enumeration hit time budget ({} ms) for workspace {}, partial count {}",
                                wallClockBudgetMs, run.credential.getWorkspaceId(), count);
                        return Mono.just(partial(count, pages));
                    }
                    return nextPage(run, page.getNextCursor(), count, pages);
                })
                .switchIfEmpty(Mono.fromSupplier(() -> partial(countSoFar, pagesFetched)));
    }

    private Mono<EnumerationPage> fetch(Run run, String cursor) {
        long remaining = Math.max(1, wallClockBudgetMs - run.elapsedMs(clock));

        return Mono.defer(() -> run.fallback.getSource().fetchPage(run.credential, cursor, pageSize))
                .retryWhen(Retry.fixedDelay(pageRetries, Duration.ofMillis(pageRetryDelayMs))
                        .filter(FallbackAggregator::isRetryable)
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .timeout(Duration.ofMillis(remaining));
    }

    static Optional<Long> extractCount(QueryResultSet result, String countColumn) {
        List<List<Object>> rows = result.getRows();
        if (rows == null || rows.isEmpty() || rows.get(0) == null || rows.get(0).isEmpty()) {
            return Optional.empty();
        }
        int index = 0;
        List<String> columns = result.getColumns();
        if (columns != null && countColumn != null && columns.contains(countColumn)) {
            index = columns.indexOf(countColumn);
        }
        List<Object> first = rows.get(0);
        if (index >= first.size()) {
            return Optional.empty();
        }
        return toLong(first.get(index));
    }

    private static Optional<Long> toLong(Object value) {
        if (value instanceof Number) {
            return Optional.of(((Number) value).longValue());
        }
        if (value instanceof String) {
            try {
                return Optional.of(Long.parseLong(((String) value).trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static long countMatches(List<Map<String, Object>> items, Predicate<Map<String, Object>> predicate) {
        if (items == null) {
            return 0;
        }
        if (predicate == null) {
            return items.size();
        }
        return items.stream().filter(predicate).count();
    }

    private static boolean isRetryable(Throwable e) {
        if (e instanceof QueryException) {
            return ((QueryException) e).isRetryable();
        }
        return true;
    }

    private static CountResult partial(long count, int pages) {
        return new CountResult(count, CountSource.FALLBACK_PARTIAL, pages);
    }

    private static final class Run {
        private final WorkspaceCredential credential;
        private final CountFallback fallback;
        private final long startedAtMs;

        private Run(WorkspaceCredential credential, CountFallback fallback, long startedAtMs) {
            this.credential = credential;
            this.fallback = fallback;
            this.startedAtMs = startedAtMs;
        }

        long elapsedMs(Clock clock) {
            return clock.millis() - startedAtMs;
        }
    }
}
