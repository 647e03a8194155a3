package org.opensearch.export.source.http;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Interface for HTTP client adapters. This abstraction keeps the transport replaceable,
 * which is how tests feed canned cluster responses to the rest client.
 */
public interface HttpClientAdapter {
    /**
     * Performs an HTTP request.
     *
     * @param method The HTTP method (GET, POST, PUT, etc.)
     * @param path The request path
     * @param body The request body, or null if no body
     * @param headers The request headers
     * @return A Mono that emits the HTTP response
     */
    Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers);

    /**
     * Checks if the client supports GZIP compression.
     *
     * @return true if GZIP compression is supported, false otherwise
     */
    boolean supportsGzipCompression();
}
