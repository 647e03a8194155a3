package org.opensearch.export.source;

import java.io.IOException;

import lombok.Getter;

/**
 * The search backend answered, but not with a successful response.
 */
@Getter
public class SearchBackendException extends IOException {
    private final int statusCode;

    public SearchBackendException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
