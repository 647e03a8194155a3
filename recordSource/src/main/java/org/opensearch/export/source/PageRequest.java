package org.opensearch.export.source;

import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.NonNull;

/**
 * A single page of a sorted search. {@code searchAfter} holds the sort values of the last record
 * already seen, or null for the first page.
 */
public record PageRequest(@NonNull RecordQuery query, int size, ArrayNode searchAfter) {
    public PageRequest {
        if (size <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + size);
        }
    }

    public boolean isFirstPage() {
        return searchAfter == null;
    }
}
