package org.opensearch.export.pipeline;

import org.opensearch.export.pipeline.ir.BucketKey;

import lombok.Getter;

/**
 * Expected and final counts collected for one bucket.
 * A bucket is complete once it has both, or once its worker failed.
 */
@Getter
public class BucketState {
    private final BucketKey bucket;
    private Long expected;
    private Long finalCount;
    private boolean failed;
    private int regenerations;

    BucketState(BucketKey bucket) {
        this.bucket = bucket;
    }

    void setExpected(long expected) {
        this.expected = expected;
    }

    void setFinalCount(long finalCount) {
        this.finalCount = finalCount;
    }

    void markFailed() {
        this.failed = true;
        this.finalCount = 0L;
    }

    /** Clears the counts ahead of a regeneration. */
    void reset() {
        expected = null;
        finalCount = null;
        failed = false;
        regenerations++;
    }

    public boolean isComplete() {
        return failed || (expected != null && finalCount != null);
    }

    /** {@code expected - final}, or null until both are known. */
    public Long getDiff() {
        return expected != null && finalCount != null ? expected - finalCount : null;
    }

    /** The difference as a percentage of the expected count; 0 when nothing was expected. */
    public Double getPct() {
        var diff = getDiff();
        if (diff == null) {
            return null;
        }
        return expected == 0 ? 0.0 : 100.0 * diff / expected;
    }
}
