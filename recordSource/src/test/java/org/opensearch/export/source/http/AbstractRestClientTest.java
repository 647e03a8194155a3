package org.opensearch.export.source.http;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class AbstractRestClientTest {

    private static class EchoAdapter implements HttpClientAdapter {
        private final List<Map<String, List<String>>> sentHeaders = new ArrayList<>();
        private final boolean gzip;

        EchoAdapter(boolean gzip) {
            this.gzip = gzip;
        }

        @Override
        public Mono<HttpResponse> request(String method, String path, String body,
                                          Map<String, List<String>> headers) {
            sentHeaders.add(headers);
            return Mono.fromSupplier(() -> new HttpResponse(200, "OK", Map.of(), method + " " + path));
        }

        @Override
        public boolean supportsGzipCompression() {
            return gzip;
        }
    }

    private static class TestRestClient extends AbstractRestClient {
        TestRestClient(ConnectionContext connectionContext, HttpClientAdapter adapter) {
            super(connectionContext, adapter);
        }
    }

    @Test
    void postCarriesJsonGzipAndCredentials() {
        var adapter = new EchoAdapter(true);
        var client = new TestRestClient(ConnectionContext.builder()
            .url("https://search.example.org:9243")
            .username("reader")
            .password("s3cret")
            .build(), adapter);

        StepVerifier.create(client.postAsync("dois/_search", "{}"))
            .assertNext(response -> {
                assertTrue(response.isSuccess());
                assertEquals("POST dois/_search", response.body());
            })
            .verifyComplete();

        var headers = adapter.sentHeaders.get(0);
        assertEquals(List.of("application/json"), headers.get("Content-Type"));
        assertEquals(List.of("search.example.org:9243"), headers.get("Host"));
        assertTrue(HttpClientUtils.hasGzipResponseHeaders(headers));
        assertEquals(List.of("Basic cmVhZGVyOnMzY3JldA=="), headers.get("Authorization"));
    }

    @Test
    void getWithoutCredentialsSendsNoBodyHeaders() {
        var adapter = new EchoAdapter(false);
        var client = new TestRestClient(ConnectionContext.builder().url("http://localhost:9200").build(), adapter);

        StepVerifier.create(client.getAsync("_cluster/health"))
            .expectNextMatches(response -> response.body().equals("GET _cluster/health"))
            .verifyComplete();

        var headers = adapter.sentHeaders.get(0);
        assertFalse(headers.containsKey("Content-Type"));
        assertFalse(headers.containsKey("Authorization"));
        assertFalse(HttpClientUtils.hasGzipResponseHeaders(headers));
        assertEquals(List.of("localhost:9200"), headers.get("Host"));
    }

    @Test
    void transportErrorsSurfaceThroughTheMono() {
        HttpClientAdapter failing = new HttpClientAdapter() {
            @Override
            public Mono<HttpResponse> request(String method, String path, String body,
                                              Map<String, List<String>> headers) {
                return Mono.error(new IllegalStateException("connection refused"));
            }

            @Override
            public boolean supportsGzipCompression() {
                return false;
            }
        };
        var client = new TestRestClient(ConnectionContext.builder().url("http://localhost:9200").build(), failing);

        StepVerifier.create(client.postAsync("dois/_count", "{}"))
            .expectErrorMessage("connection refused")
            .verify();
    }
}
