package org.opensearch.export.source;

/**
 * Raised when the backend keeps reporting timed-out searches for a stream.
 */
public class TooManyTimeoutsException extends PagedResultStreamException {
    public TooManyTimeoutsException(int timeouts) {
        super("Search timed out " + timeouts + " times, giving up");
    }
}
