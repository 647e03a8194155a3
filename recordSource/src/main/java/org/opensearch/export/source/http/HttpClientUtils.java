package org.opensearch.export.source.http;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Utility methods for HTTP clients.
 */
public class HttpClientUtils {
    private static final String ACCEPT_ENCODING_HEADER_NAME = "Accept-Encoding";
    private static final String AUTHORIZATION_HEADER_NAME = "Authorization";
    private static final String GZIP_TYPE = "gzip";

    private HttpClientUtils() {
        // Utility class, no instances
    }

    /**
     * Adds GZIP response headers to the given headers map.
     *
     * @param headers The headers map to add to
     */
    public static void addGzipResponseHeaders(Map<String, List<String>> headers) {
        headers.put(ACCEPT_ENCODING_HEADER_NAME, List.of(GZIP_TYPE));
    }

    /**
     * Checks if the given headers map has GZIP response headers.
     *
     * @param headers The headers map to check
     * @return true if the headers map has GZIP response headers, false otherwise
     */
    public static boolean hasGzipResponseHeaders(Map<String, List<String>> headers) {
        return headers.getOrDefault(ACCEPT_ENCODING_HEADER_NAME, List.of()).contains(GZIP_TYPE);
    }

    /**
     * Adds a basic-auth Authorization header for the given credentials.
     */
    public static void addBasicAuthHeader(Map<String, List<String>> headers, String username, String password) {
        var token = Base64.getEncoder()
            .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        headers.put(AUTHORIZATION_HEADER_NAME, List.of("Basic " + token));
    }
}
