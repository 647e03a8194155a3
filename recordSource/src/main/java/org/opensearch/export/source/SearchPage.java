package org.opensearch.export.source;

import java.util.List;

/**
 * Response to a {@link PageRequest}. A response with {@code timedOut} set carries partial or no
 * results and must be requested again.
 */
public record SearchPage(List<SearchRecord> records, boolean timedOut) {

    public static SearchPage timedOutPage() {
        return new SearchPage(List.of(), true);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
