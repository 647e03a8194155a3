package org.opensearch.export.source.http;

import java.util.Map;

/**
 * A fully read HTTP response.
 */
public record HttpResponse(int statusCode, String statusText, Map<String, String> headers, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
