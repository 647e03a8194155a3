package org.opensearch.export.source;

import java.util.List;

/**
 * Record counts per calendar month of the {@code updated} field.
 *
 * @param buckets one entry per month, keyed {@code yyyy-MM}, in ascending order
 * @param totalHits total number of matching records
 */
public record MonthlyHistogram(List<Bucket> buckets, long totalHits) {
    public record Bucket(String key, long docCount) {}
}
