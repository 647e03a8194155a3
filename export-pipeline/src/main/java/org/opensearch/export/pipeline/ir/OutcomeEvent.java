package org.opensearch.export.pipeline.ir;

import lombok.NonNull;

/**
 * A count reported for a bucket. Events for different buckets arrive in no particular order and
 * a bucket's {@code FINAL} may arrive before its {@code EXPECTED}.
 */
public record OutcomeEvent(@NonNull BucketKey bucket, long count, @NonNull Phase phase) {

    public enum Phase {
        /** Authoritative count from the index. */
        EXPECTED,
        /** Number of records a worker exported. */
        FINAL,
        /** The worker exporting the bucket died. */
        FAILED
    }

    public static OutcomeEvent expected(BucketKey bucket, long count) {
        return new OutcomeEvent(bucket, count, Phase.EXPECTED);
    }

    public static OutcomeEvent finalCount(BucketKey bucket, long count) {
        return new OutcomeEvent(bucket, count, Phase.FINAL);
    }

    public static OutcomeEvent failed(BucketKey bucket) {
        return new OutcomeEvent(bucket, 0, Phase.FAILED);
    }
}
