package com.queryhub.domain.service;

import com.queryhub.domain.model.CountSource;
import com.queryhub.domain.model.EnumerationPage;
import com.queryhub.domain.model.ExecutionResult;
import com.queryhub.domain.model.ExecutionStatus;
import com.queryhub.domain.model.IssuedBy;
import com.queryhub.domain.model.MtuResult;
import com.queryhub.domain.model.QueryOptions;
import com.queryhub.domain.model.QueryRequest;
import com.queryhub.domain.model.RateLimitScope;
import com.queryhub.domain.model.WorkspaceCredential;
import com.queryhub.infrastructure.engine.AnalyticsEngineClient;
import com.queryhub.infrastructure.engine.AnalyticsEngineClientFactory;
import com.queryhub.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MtuServiceTest {

    @Mock
    private QueryOrchestrator orchestrator;

    @Mock
    private AnalyticsEngineClientFactory clientFactory;

    @Mock
    private AnalyticsEngineClient client;

    private MtuService mtuService;

    @BeforeEach
    void setUp() {
        mtuService = new MtuService(orchestrator, clientFactory, MutableClock.startingAt("2026-03-01T02:00:00Z"));
    }

    @Test
    void testCalculate_UsesCountScopeAndFallback() {
        // Given
        when(orchestrator.execute(any(), any())).thenReturn(Mono.just(result(1500L, false, null)));

        // When
        MtuResult mtu = mtuService.calculate("ws-1", IssuedBy.MACHINE, true).block();

        // Then
        assertEquals(1500, mtu.getMtuCount());
        assertEquals("primary", mtu.getSource());
        assertEquals(LocalDate.of(2026, 3, 1), mtu.getTrackedDate());

        ArgumentCaptor<QueryRequest> request = ArgumentCaptor.forClass(QueryRequest.class);
        ArgumentCaptor<QueryOptions> options = ArgumentCaptor.forClass(QueryOptions.class);
        verify(orchestrator).execute(request.capture(), options.capture());
        assertEquals(MtuService.mtuQuery(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 31)),
                request.getValue().getQueryText());
        assertEquals(RateLimitScope.COUNT, options.getValue().getRateLimitScope());
        assertEquals(Duration.ofHours(1), options.getValue().getCacheTtl());
        assertTrue(options.getValue().isSkipCache());
        assertEquals(MtuService.COUNT_COLUMN, options.getValue().getCountFallback().getCountColumn());
    }

    @Test
    void testCalculate_QueriesEventsInCurrentBillingCycle() {
        // Given: clock is mid-February of a leap year
        mtuService = new MtuService(orchestrator, clientFactory, MutableClock.startingAt("2028-02-17T15:30:00Z"));
        when(orchestrator.execute(any(), any())).thenReturn(Mono.just(result(42L, false, null)));

        // When
        MtuResult mtu = mtuService.calculate("ws-1", IssuedBy.USER, false).block();

        // Then
        ArgumentCaptor<QueryRequest> request = ArgumentCaptor.forClass(QueryRequest.class);
        verify(orchestrator).execute(request.capture(), any());
        String sent = request.getValue().getQueryText();
        assertTrue(sent.contains("FROM events"));
        assertTrue(sent.contains("count(DISTINCT person_id)"));
        assertTrue(sent.contains("timestamp >= toDateTime('2028-02-01')"));
        assertTrue(sent.contains("timestamp <= toDateTime('2028-02-29 23:59:59')"));
        assertTrue(sent.contains("properties['email'] != ''"));

        assertEquals(LocalDate.of(2028, 2, 1), mtu.getBillingCycleStart());
        assertEquals(LocalDate.of(2028, 2, 29), mtu.getBillingCycleEnd());
        assertEquals(LocalDate.of(2028, 2, 17), mtu.getTrackedDate());
    }

    @Test
    void testMtuQuery_PassesReadOnlyValidation() {
        String query = MtuService.mtuQuery(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 31));

        assertDoesNotThrow(() -> new QueryValidator(10_000).validate(query));
    }

    @Test
    void testCalculate_ReportsCacheAndFallbackSources() {
        // Given
        when(orchestrator.execute(any(), any()))
                .thenReturn(Mono.just(result(10L, true, null)))
                .thenReturn(Mono.just(result(7L, false, CountSource.FALLBACK_PARTIAL)));

        // When
        MtuResult cached = mtuService.calculate("ws-1", IssuedBy.USER, false).block();
        MtuResult partial = mtuService.calculate("ws-1", IssuedBy.USER, false).block();

        // Then
        assertEquals("cache", cached.getSource());
        assertTrue(cached.isCached());
        assertEquals("fallback_partial", partial.getSource());
        assertEquals(7, partial.getMtuCount());
    }

    @Test
    void testFallbackSource_PagesPersonsOfTheCredential() {
        // Given
        when(orchestrator.execute(any(), any())).thenReturn(Mono.just(result(0L, false, null)));
        mtuService.calculate("ws-1", IssuedBy.USER, false).block();
        ArgumentCaptor<QueryOptions> options = ArgumentCaptor.forClass(QueryOptions.class);
        verify(orchestrator).execute(any(), options.capture());

        WorkspaceCredential credential = WorkspaceCredential.builder().workspaceId("ws-1").build();
        EnumerationPage page = new EnumerationPage(List.of(), null);
        when(clientFactory.forCredential(credential)).thenReturn(client);
        when(client.persons("cursor-1", 100)).thenReturn(Mono.just(page));

        // When
        EnumerationPage fetched = options.getValue().getCountFallback().getSource()
                .fetchPage(credential, "cursor-1", 100).block();

        // Then
        assertSame(page, fetched);
    }

    @Test
    void testHasEmail() {
        assertTrue(MtuService.hasEmail(Map.of("properties", Map.of("email", "a@b.co"))));
        assertFalse(MtuService.hasEmail(Map.of("properties", Map.of("email", " "))));
        assertFalse(MtuService.hasEmail(Map.of("properties", Map.of("name", "Ann"))));
        assertFalse(MtuService.hasEmail(Map.of("id", 4)));
    }

    private static ExecutionResult result(long count, boolean cached, CountSource countSource) {
        List<Object> row = List.of(count);
        return ExecutionResult.builder()
                .queryId("q-1")
                .status(countSource == CountSource.FALLBACK_PARTIAL ? ExecutionStatus.PARTIAL : ExecutionStatus.COMPLETED)
                .columns(List.of(MtuService.COUNT_COLUMN))
                .rows(List.of(row))
                .rowCount(1)
                .cached(cached)
                .countSource(countSource)
                .build();
    }
}
