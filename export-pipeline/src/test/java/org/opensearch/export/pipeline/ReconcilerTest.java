package org.opensearch.export.pipeline;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.opensearch.export.pipeline.ir.BucketKey;
import org.opensearch.export.pipeline.ir.Job;
import org.opensearch.export.pipeline.ir.OutcomeEvent;
import org.opensearch.export.pipeline.output.ResultsReportWriter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class ReconcilerTest {
    private static final BucketKey JANUARY = new BucketKey(2024, 1);
    private static final BucketKey FEBRUARY = new BucketKey(2024, 2);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final OutcomeChannel outcomes = new OutcomeChannel();
    private final JobQueue jobs = new JobQueue();
    private final AtomicInteger shutdownSignals = new AtomicInteger();

    private Reconciler reconciler(boolean reconciling) {
        return new Reconciler(outcomes, jobs, shutdownSignals::incrementAndGet, new RegenerationPolicy(10, 50, 3),
            CLOCK, reconciling, new ResultsReportWriter(tempDir.resolve("results.csv")));
    }

    @Test
    void signalsShutdownOnceAfterEveryBucketIsReconciled() throws InterruptedException {
        var reconciler = reconciler(true);

        reconciler.onEvent(OutcomeEvent.expected(JANUARY, 100));
        reconciler.onEvent(OutcomeEvent.expected(FEBRUARY, 100));
        reconciler.onEvent(OutcomeEvent.finalCount(JANUARY, 100));
        assertEquals(0, shutdownSignals.get());

        reconciler.onEvent(OutcomeEvent.finalCount(FEBRUARY, 98));
        assertEquals(1, shutdownSignals.get());

        // A late duplicate must not trigger a second signal
        reconciler.onEvent(OutcomeEvent.finalCount(FEBRUARY, 99));
        assertEquals(1, shutdownSignals.get());
        assertEquals(1, reconciler.getRounds());
    }

    @Test
    void regeneratesDriftingBucketThenShutsDown() throws InterruptedException {
        var reconciler = reconciler(true);
        reconciler.onEvent(OutcomeEvent.expected(JANUARY, 100));
        reconciler.onEvent(OutcomeEvent.expected(FEBRUARY, 100));
        reconciler.onEvent(OutcomeEvent.finalCount(JANUARY, 100));
        reconciler.onEvent(OutcomeEvent.finalCount(FEBRUARY, 40));

        assertEquals(0, shutdownSignals.get());
        assertEquals(Optional.of(Job.regenerate(FEBRUARY)), jobs.take());
        assertEquals(1, jobs.getInFlightCount());
        assertFalse(reconciler.getTable().isComplete());

        // The regeneration worker reports a fresh expected count and its final count
        reconciler.onEvent(OutcomeEvent.finalCount(FEBRUARY, 100));
        assertEquals(0, shutdownSignals.get());
        reconciler.onEvent(OutcomeEvent.expected(FEBRUARY, 100));

        assertEquals(1, shutdownSignals.get());
        assertEquals(2, reconciler.getRounds());
        assertEquals(1, reconciler.getTable().get(FEBRUARY).getRegenerations());
        assertEquals(0L, reconciler.getTable().get(FEBRUARY).getDiff());
    }

    @Test
    void simpleModeNeverRegeneratesOrSignals() throws InterruptedException {
        var reconciler = reconciler(false);
        reconciler.onEvent(OutcomeEvent.expected(FEBRUARY, 100));
        reconciler.onEvent(OutcomeEvent.finalCount(FEBRUARY, 0));

        assertEquals(0, shutdownSignals.get());
        assertEquals(0, jobs.getInFlightCount());
        assertEquals(100L, reconciler.getTable().get(FEBRUARY).getDiff());
    }

    @Test
    void writesReportOnShutdownSignal() throws Exception {
        var reconciler = reconciler(false);
        var thread = new Thread(reconciler, "reconciler");
        thread.start();

        outcomes.publish(OutcomeEvent.expected(JANUARY, 100));
        outcomes.publish(OutcomeEvent.expected(FEBRUARY, 100));
        outcomes.publish(OutcomeEvent.finalCount(FEBRUARY, 40));
        outcomes.publish(OutcomeEvent.finalCount(JANUARY, 100));
        outcomes.signalShutdown();

        var table = reconciler.getCompletion().get(10, TimeUnit.SECONDS);
        thread.join();
        assertEquals(2, table.size());
        assertEquals(List.of("2024-01,100,100,0,0.00", "2024-02,100,40,60,60.00"),
            Files.readAllLines(tempDir.resolve("results.csv")));
    }
}
