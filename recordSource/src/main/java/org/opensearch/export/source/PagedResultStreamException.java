package org.opensearch.export.source;

/**
 * A paged result stream gave up. The stream is unusable afterwards.
 */
public class PagedResultStreamException extends RuntimeException {
    public PagedResultStreamException(String message) {
        super(message);
    }

    public PagedResultStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
