package com.queryhub.domain.service;

import com.queryhub.domain.model.CountFallback;
import com.queryhub.domain.model.ExecutionResult;
import com.queryhub.domain.model.IssuedBy;
import com.queryhub.domain.model.MtuResult;
import com.queryhub.domain.model.PostHogConfig;
import com.queryhub.domain.model.QueryOptions;
import com.queryhub.domain.model.QueryRequest;
import com.queryhub.domain.model.RateLimitScope;
import com.queryhub.infrastructure.engine.AnalyticsEngineClientFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Monthly tracked users: distinct identified persons (those with an email)
 * that sent at least one event in the current billing cycle.
 *
 * The billing cycle is the calendar month of the injected clock. Runs through
 * the orchestrator under the COUNT quota. When the aggregate query fails the
 * persons endpoint is paged and filtered instead; that path has no event
 * window, so it counts every identified person.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MtuService {

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    static final String COUNT_COLUMN = "mtu_count";
    static final Duration CACHE_TTL = Duration.ofHours(1);

    private final QueryOrchestrator orchestrator;
    private final AnalyticsEngineClientFactory clientFactory;
    private final Clock clock;

    public Mono<MtuResult> calculate(String workspaceId, IssuedBy issuedBy, boolean skipCache) {
        LocalDate cycleStart = LocalDate.now(clock).withDayOfMonth(1);
        LocalDate cycleEnd = cycleStart.with(TemporalAdjusters.lastDayOfMonth());

        QueryRequest request = QueryRequest.builder()
                .workspaceId(workspaceId)
                .queryText(mtuQuery(cycleStart, cycleEnd))
                .issuedBy(issuedBy)
                .build();

        QueryOptions options = QueryOptions.builder()
                .skipCache(skipCache)
                .cacheTtl(CACHE_TTL)
                .rateLimitScope(RateLimitScope.COUNT)
                .integrationName(PostHogConfig.NAME)
                .countFallback(CountFallback.builder()
                        .source((credential, cursor, pageSize) ->
                                clientFactory.forCredential(credential).persons(cursor, pageSize))
                        .predicate(MtuService::hasEmail)
                        .countColumn(COUNT_COLUMN)
                        .build())
                .build();

        return orchestrator.execute(request, options)
                .map(result -> toMtu(workspaceId, result, cycleStart, cycleEnd))
                .doOnNext(mtu -> log.info("MTU for workspace {}: {} ({})",
                        workspaceId, mtu.getMtuCount(), mtu.getSource()));
    }

    /**
     * Distinct identified persons with events between {@code start} 00:00:00
     * and {@code end} 23:59:59.
     */
    static String mtuQuery(LocalDate start, LocalDate end) {
        return "SELECT count(DISTINCT person_id) AS " + COUNT_COLUMN + " FROM events "
                + "WHERE timestamp >= toDateTime('" + sanitize(start) + "') "
                + "AND timestamp <= toDateTime('" + sanitize(end) + " 23:59:59') "
                + "AND person_id IN (SELECT id FROM persons "
                + "WHERE properties['email'] IS NOT NULL AND properties['email'] != '')";
    }

    private static String sanitize(LocalDate date) {
        String formatted = date.format(DateTimeFormatter.ISO_LOCAL_DATE);
        if (!ISO_DATE.matcher(formatted).matches()) {
            throw new IllegalArgumentException("Invalid billing cycle date: " + formatted);
        }
        return formatted;
    }

    private MtuResult toMtu(String workspaceId, ExecutionResult result, LocalDate cycleStart, LocalDate cycleEnd) {
        String source;
        if (result.isCached()) {
            source = "cache";
        } else if (result.getCountSource() != null) {
            source = result.getCountSource().getValue();
        } else {
            source = "primary";
        }
        return MtuResult.builder()
                .workspaceId(workspaceId)
                .mtuCount(firstCell(result.getRows()))
                .source(source)
                .trackedDate(LocalDate.now(clock))
                .billingCycleStart(cycleStart)
                .billingCycleEnd(cycleEnd)
                .cached(result.isCached())
                .build();
    }

    private static long firstCell(List<List<Object>> rows) {
        if (rows == null || rows.isEmpty() || rows.get(0).isEmpty()) {
            return 0;
        }
        Object value = rows.get(0).get(0);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static boolean hasEmail(Map<String, Object> person) {
        Object properties = person.get("properties");
        if (!(properties instanceof Map)) {
            return false;
        }
        Object email = ((Map<?, ?>) properties).get("email");
        return email != null && !String.valueOf(email).isBlank();
    }
}
