package org.opensearch.export.source.http;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * Base of the cluster clients. Every request carries the same user agent, a Host header derived
 * from the cluster URI, a JSON content type when it has a body, {@code Accept-Encoding: gzip} when
 * the transport can inflate responses, and basic auth when credentials are configured. The
 * transport itself is an {@link HttpClientAdapter}.
 */
public abstract class AbstractRestClient implements AutoCloseable {
    private static final String USER_AGENT = "DatafileExport-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";

    @Getter
    protected final ConnectionContext connectionContext;
    protected final HttpClientAdapter httpClientAdapter;

    protected AbstractRestClient(ConnectionContext connectionContext, HttpClientAdapter httpClientAdapter) {
        this.connectionContext = connectionContext;
        this.httpClientAdapter = httpClientAdapter;
    }

    /** Host, plus the port when it is not the scheme's default. */
    public static String getHostHeaderValue(ConnectionContext connectionContext) {
        var uri = connectionContext.getUri();
        int defaultPort = connectionContext.getProtocol() == ConnectionContext.Protocol.HTTPS ? 443 : 80;
        if (uri.getPort() == -1 || uri.getPort() == defaultPort) {
            return uri.getHost();
        }
        return uri.getHost() + ":" + uri.getPort();
    }

    /**
     * @param extraHeaders replace the standard header of the same name, compared case-insensitively;
     *                     may be null
     */
    public Mono<HttpResponse> asyncRequest(String method, String path, String body,
                                           Map<String, List<String>> extraHeaders) {
        return httpClientAdapter.request(method, path, body, prepareHeaders(body, extraHeaders));
    }

    protected Map<String, List<String>> prepareHeaders(String body, Map<String, List<String>> extraHeaders) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("User-Agent", List.of(USER_AGENT));
        headers.put("Host", List.of(getHostHeaderValue(connectionContext)));
        if (body != null) {
            headers.put("Content-Type", List.of(JSON_CONTENT_TYPE));
        }
        if (supportsGzipCompression()) {
            HttpClientUtils.addGzipResponseHeaders(headers);
        }
        if (connectionContext.hasBasicAuth()) {
            HttpClientUtils.addBasicAuthHeader(headers, connectionContext.getUsername(),
                connectionContext.getPassword());
        }
        if (extraHeaders != null) {
            extraHeaders.forEach((name, values) -> {
                headers.keySet().removeIf(existing -> existing.toLowerCase(Locale.ROOT)
                    .equals(name.toLowerCase(Locale.ROOT)));
                headers.put(name, values);
            });
        }
        return headers;
    }

    public boolean supportsGzipCompression() {
        return httpClientAdapter.supportsGzipCompression();
    }

    public Mono<HttpResponse> getAsync(String path) {
        return asyncRequest("GET", path, null, null);
    }

    public Mono<HttpResponse> postAsync(String path, String body) {
        return asyncRequest("POST", path, body, null);
    }

    @Override
    public void close() {
        // nothing held by default
    }
}
