package org.opensearch.export.source;

import java.io.IOException;

/**
 * Port to the search backend holding the records. Implementations report a backend-side timeout
 * through {@link SearchPage#timedOut()} and transport or server failures by throwing.
 */
public interface RecordSearchClient extends AutoCloseable {

    /** Fetch one page of records sorted by {@link RecordFields#SORT_FIELDS}. */
    SearchPage search(PageRequest request) throws IOException;

    /** Authoritative number of records matching the query. */
    long count(RecordQuery query) throws IOException;

    /** Record counts per month of the {@code updated} field for the query. */
    MonthlyHistogram monthlyHistogram(RecordQuery query) throws IOException;

    @Override
    default void close() throws Exception {
        // Default no-op for clients that don't hold resources
    }
}
