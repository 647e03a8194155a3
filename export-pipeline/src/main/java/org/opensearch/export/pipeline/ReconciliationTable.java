package org.opensearch.export.pipeline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.opensearch.export.pipeline.ir.BucketKey;
import org.opensearch.export.pipeline.ir.OutcomeEvent;
import org.opensearch.export.pipeline.output.ResultsReportWriter;

import lombok.extern.slf4j.Slf4j;

/**
 * Per-bucket reconciliation state, keyed by bucket. Owned by a single thread.
 */
@Slf4j
public class ReconciliationTable {
    private final Map<BucketKey, BucketState> states = new TreeMap<>();

    /** Merges an event into its bucket's state. A repeated phase replaces the earlier value. */
    public BucketState apply(OutcomeEvent event) {
        var state = states.computeIfAbsent(event.bucket(), BucketState::new);
        switch (event.phase()) {
            case EXPECTED:
                if (state.getExpected() != null) {
                    log.warn("Duplicate EXPECTED for {}. Old value: {}, new value: {}",
                        event.bucket(), state.getExpected(), event.count());
                }
                if (event.count() == 0) {
                    log.warn("Expected count for {} is zero", event.bucket());
                }
                state.setExpected(event.count());
                break;
            case FINAL:
                if (state.getFinalCount() != null) {
                    log.warn("Duplicate FINAL for {}. Old value: {}, new value: {}",
                        event.bucket(), state.getFinalCount(), event.count());
                }
                state.setFinalCount(event.count());
                break;
            case FAILED:
                log.warn("Export of {} failed", event.bucket());
                state.markFailed();
                break;
            default:
                throw new IllegalArgumentException("Unknown phase " + event.phase());
        }
        if (state.getDiff() != null) {
            log.atInfo().setMessage("Reconciled {}: expected {}, final {}, diff {}")
                .addArgument(state::getBucket)
                .addArgument(state::getExpected)
                .addArgument(state::getFinalCount)
                .addArgument(state::getDiff)
                .log();
        }
        return state;
    }

    /** True when at least one bucket is tracked and every tracked bucket is complete. */
    public boolean isComplete() {
        return !states.isEmpty() && states.values().stream().allMatch(BucketState::isComplete);
    }

    /** Clears a bucket's counts ahead of regenerating it. It stays tracked. */
    public void reset(BucketKey bucket) {
        var state = states.get(bucket);
        if (state == null) {
            throw new IllegalArgumentException("Bucket " + bucket + " is not tracked");
        }
        state.reset();
    }

    public BucketState get(BucketKey bucket) {
        return states.get(bucket);
    }

    /** States in bucket order. */
    public Collection<BucketState> getStates() {
        return Collections.unmodifiableCollection(states.values());
    }

    public int size() {
        return states.size();
    }

    public List<ResultsReportWriter.Line> toReportLines() {
        List<ResultsReportWriter.Line> lines = new ArrayList<>();
        for (BucketState state : states.values()) {
            lines.add(new ResultsReportWriter.Line(state.getBucket().toString(), state.getExpected(),
                state.getFinalCount(), state.getDiff(), state.getPct()));
        }
        return lines;
    }
}
