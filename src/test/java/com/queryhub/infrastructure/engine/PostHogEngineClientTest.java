package com.queryhub.infrastructure.engine;

import com.queryhub.domain.error.UpstreamApiException;
import com.queryhub.domain.model.EnumerationPage;
import com.queryhub.domain.model.QueryResultSet;
import com.queryhub.domain.model.TableInfo;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PostHogEngineClientTest {

    private static final String HOST = "https://eu.posthog.com";

    private final List<ClientRequest> requests = new ArrayList<>();

    private PostHogEngineClient client(HttpStatus status, String json) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(json)
                    .build());
        });
        return new PostHogEngineClient(builder, HOST + "/", "42", "phx_secret");
    }

    @Test
    void testQuery_MapsColumnsAndRows() {
        // Given
        PostHogEngineClient client = client(HttpStatus.OK,
                "{\"columns\":[\"event\",\"total\"],\"results\":[[\"pageview\",12],[\"signup\",3]],\"hogql\":\"...\"}");

        // When
        QueryResultSet result = client.query("SELECT event, count() AS total FROM events GROUP BY event").block();

        // Then
        assertEquals(List.of("event", "total"), result.getColumns());
        assertEquals(2, result.getRowCount());
        assertEquals("signup", result.getRows().get(1).get(0));

        ClientRequest sent = requests.get(0);
        assertEquals(HOST + "/api/projects/42/query/", sent.url().toString());
        assertEquals("Bearer phx_secret", sent.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testQuery_HttpErrorBecomesUpstreamWithoutBody() {
        // Given
        PostHogEngineClient client = client(HttpStatus.UNAUTHORIZED, "{\"detail\":\"key phx_secret is invalid\"}");

        // When / Then
        StepVerifier.create(client.query("SELECT 1"))
                .expectErrorSatisfies(e -> {
                    UpstreamApiException upstream = assertInstanceOf(UpstreamApiException.class, e);
                    assertEquals(401, upstream.getStatusCode());
                    assertFalse(upstream.isRetryable());
                    assertFalse(upstream.getMessage().contains("phx_secret"));
                })
                .verify();
    }

    @Test
    void testQuery_ServerErrorIsRetryable() {
        PostHogEngineClient client = client(HttpStatus.BAD_GATEWAY, "{}");

        StepVerifier.create(client.query("SELECT 1"))
                .expectErrorSatisfies(e -> assertTrue(((UpstreamApiException) e).isRetryable()))
                .verify();
    }

    @Test
    void testPersons_FirstPageAndNextCursor() {
        // Given
        PostHogEngineClient client = client(HttpStatus.OK,
                "{\"results\":[{\"id\":1,\"properties\":{\"email\":\"a@b.co\"}}],"
                        + "\"next\":\"https://eu.posthog.com/api/projects/42/persons/?cursor=abc\"}");

        // When
        EnumerationPage page = client.persons(null, 100).block();

        // Then
        assertEquals(1, page.getItems().size());
        assertTrue(page.hasMore());
        assertEquals(HOST + "/api/projects/42/persons/?limit=100", requests.get(0).url().toString());
    }

    @Test
    void testPersons_FollowsSameHostCursor() {
        // Given
        PostHogEngineClient client = client(HttpStatus.OK, "{\"results\":[],\"next\":null}");

        // When
        EnumerationPage page = client.persons(HOST + "/api/projects/42/persons/?cursor=abc", 100).block();

        // Then
        assertFalse(page.hasMore());
        assertEquals(HOST + "/api/projects/42/persons/?cursor=abc", requests.get(0).url().toString());
    }

    @Test
    void testPersons_RejectsForeignCursor() {
        PostHogEngineClient client = client(HttpStatus.OK, "{}");

        StepVerifier.create(client.persons("https://evil.example/steal", 100))
                .expectError(UpstreamApiException.class)
                .verify();
        assertTrue(requests.isEmpty());
    }

    @Test
    void testWarehouseTables() {
        // Given
        PostHogEngineClient client = client(HttpStatus.OK,
                "{\"results\":[{\"name\":\"stripe_charges\",\"external_data_source\":{\"source_type\":\"Stripe\"}},"
                        + "{\"name\":\"uploaded_csv\"}]}");

        // When
        List<TableInfo> tables = client.warehouseTables().block();

        // Then
        assertEquals(2, tables.size());
        assertEquals("Stripe", tables.get(0).getSourceType());
        assertNull(tables.get(1).getSourceType());
    }

    @Test
    void testSchemaTables() {
        // Given
        PostHogEngineClient client = client(HttpStatus.OK,
                "{\"tables\":{\"events\":{\"name\":\"events\",\"type\":\"posthog\"},"
                        + "\"numbers\":{\"name\":\"numbers\",\"type\":\"virtual_table\"}}}");

        // When
        Map<String, String> tables = client.schemaTables().block();

        // Then
        assertEquals("posthog", tables.get("events"));
        assertEquals("virtual_table", tables.get("numbers"));
    }
}
