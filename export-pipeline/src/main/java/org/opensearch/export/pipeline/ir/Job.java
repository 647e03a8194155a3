package org.opensearch.export.pipeline.ir;

import lombok.NonNull;

/**
 * A request to export one bucket. {@code expectedCount} is null for regeneration jobs, whose
 * worker fetches a fresh count from the index before exporting.
 */
public record Job(@NonNull BucketKey bucket, Long expectedCount) {

    public static Job regenerate(BucketKey bucket) {
        return new Job(bucket, null);
    }

    public boolean hasExpectedCount() {
        return expectedCount != null;
    }
}
