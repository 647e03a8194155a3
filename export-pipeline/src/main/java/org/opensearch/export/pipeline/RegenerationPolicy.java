package org.opensearch.export.pipeline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.opensearch.export.pipeline.ir.BucketKey;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides, once every bucket is complete, whether the run is done or which buckets to export
 * again.
 *
 * <p>The discrepancy of the run is the sum of {@code expected - final} over every reconciled
 * bucket except the current month, which is still receiving updates. A sum within
 * {@code totalThreshold} ends the run. Otherwise every bucket whose own discrepancy exceeds
 * {@code monthThreshold} is regenerated. Failed buckets are regenerated regardless, and a bucket
 * that has already been regenerated {@code maxRegenerations} times is never picked again.</p>
 */
@Slf4j
public class RegenerationPolicy {

    public record Decision(long totalDiscrepancy, List<BucketKey> regenerate) {
        public boolean isShutdown() {
            return regenerate.isEmpty();
        }
    }

    private final long totalThreshold;
    private final long monthThreshold;
    private final int maxRegenerations;

    public RegenerationPolicy(long totalThreshold, long monthThreshold, int maxRegenerations) {
        this.totalThreshold = totalThreshold;
        this.monthThreshold = monthThreshold;
        this.maxRegenerations = maxRegenerations;
    }

    public static RegenerationPolicy from(ExportSettings settings) {
        return new RegenerationPolicy(settings.getTotalDiscrepancyThreshold(),
            settings.getMonthDiscrepancyThreshold(), settings.getMaxRegenerations());
    }

    public Decision decide(Collection<BucketState> states, BucketKey currentMonth) {
        long total = 0;
        for (BucketState state : states) {
            if (!state.getBucket().equals(currentMonth) && state.getDiff() != null) {
                total += state.getDiff();
            }
        }
        boolean withinTolerance = total <= totalThreshold;

        List<BucketKey> selected = new ArrayList<>();
        for (BucketState state : states) {
            boolean wanted = state.isFailed()
                || (!withinTolerance && state.getDiff() != null && state.getDiff() > monthThreshold);
            if (!wanted) {
                continue;
            }
            if (state.getRegenerations() >= maxRegenerations) {
                log.warn("Not regenerating {}: already regenerated {} times (expected {}, final {}, diff {})",
                    state.getBucket(), state.getRegenerations(), state.getExpected(), state.getFinalCount(),
                    state.getDiff());
                continue;
            }
            selected.add(state.getBucket());
        }
        return new Decision(total, List.copyOf(selected));
    }
}
