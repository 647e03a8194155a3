package org.opensearch.export.source;

/**
 * Raised when requests for a stream keep failing with transport or backend errors.
 */
public class TooManyFailuresException extends PagedResultStreamException {
    public TooManyFailuresException(int failures, Throwable lastFailure) {
        super("Search failed " + failures + " times, giving up", lastFailure);
    }
}
