package org.opensearch.export.pipeline;

import java.util.List;

import org.opensearch.export.pipeline.ir.BucketKey;
import org.opensearch.export.pipeline.ir.OutcomeEvent;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegenerationPolicyTest {
    private static final BucketKey JANUARY = new BucketKey(2024, 1);
    private static final BucketKey FEBRUARY = new BucketKey(2024, 2);
    private static final BucketKey MARCH = new BucketKey(2024, 3);
    private static final BucketKey CURRENT = new BucketKey(2025, 6);

    private final RegenerationPolicy policy = new RegenerationPolicy(10, 50, 3);
    private final ReconciliationTable table = new ReconciliationTable();

    private void reconcile(BucketKey bucket, long expected, long finalCount) {
        table.apply(OutcomeEvent.expected(bucket, expected));
        table.apply(OutcomeEvent.finalCount(bucket, finalCount));
    }

    @Test
    void withinTotalThresholdShutsDown() {
        reconcile(JANUARY, 100, 95);
        reconcile(FEBRUARY, 100, 95);

        var decision = policy.decide(table.getStates(), CURRENT);

        assertTrue(decision.isShutdown());
        assertEquals(10, decision.totalDiscrepancy());
    }

    @Test
    void selectsExactlyTheBucketsAboveMonthThreshold() {
        reconcile(JANUARY, 100, 100);
        reconcile(FEBRUARY, 100, 49);
        reconcile(MARCH, 100, 50);

        var decision = policy.decide(table.getStates(), CURRENT);

        // 0 + 51 + 50 > 10, and only February is above 50
        assertEquals(101, decision.totalDiscrepancy());
        assertEquals(List.of(FEBRUARY), decision.regenerate());
    }

    @Test
    void aboveTotalButNoBucketAboveMonthThresholdShutsDown() {
        reconcile(JANUARY, 100, 70);
        reconcile(FEBRUARY, 100, 70);

        var decision = policy.decide(table.getStates(), CURRENT);

        assertEquals(60, decision.totalDiscrepancy());
        assertTrue(decision.isShutdown());
    }

    @Test
    void currentMonthIsLeftOutOfTheTotal() {
        reconcile(JANUARY, 100, 100);
        reconcile(CURRENT, 1000, 100);

        var decision = policy.decide(table.getStates(), CURRENT);

        assertEquals(0, decision.totalDiscrepancy());
        assertTrue(decision.isShutdown());
    }

    @Test
    void currentMonthCanStillBeSelectedWhenTheRestDrifts() {
        reconcile(JANUARY, 100, 0);
        reconcile(CURRENT, 1000, 100);

        var decision = policy.decide(table.getStates(), CURRENT);

        assertEquals(100, decision.totalDiscrepancy());
        assertEquals(List.of(JANUARY, CURRENT), decision.regenerate());
    }

    @Test
    void failedBucketsAreAlwaysSelected() {
        reconcile(JANUARY, 100, 100);
        table.apply(OutcomeEvent.failed(FEBRUARY));

        var decision = policy.decide(table.getStates(), CURRENT);

        assertEquals(List.of(FEBRUARY), decision.regenerate());
    }

    @Test
    void exhaustedBucketsAreNoLongerSelected() {
        reconcile(FEBRUARY, 100, 0);
        for (int i = 0; i < 3; i++) {
            table.reset(FEBRUARY);
            reconcile(FEBRUARY, 100, 0);
        }

        var decision = policy.decide(table.getStates(), CURRENT);

        assertEquals(100, decision.totalDiscrepancy());
        assertTrue(decision.isShutdown());
    }
}
