package org.opensearch.export.pipeline;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

import org.opensearch.export.pipeline.ir.BucketKey;
import org.opensearch.export.pipeline.ir.Job;
import org.opensearch.export.pipeline.ir.OutcomeEvent;
import org.opensearch.export.pipeline.output.ResultsReportWriter;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Consumes outcome events, keeps the {@link ReconciliationTable} and, when reconciling, decides
 * after each event that completes the table whether to regenerate buckets or stop the workers.
 * The stop signal is sent at most once.
 *
 * <p>Runs until the outcome channel's shutdown signal, then writes the results report and
 * completes {@link #getCompletion()} with the final table.</p>
 */
@Slf4j
public class Reconciler implements Runnable {
    private final OutcomeChannel outcomes;
    private final JobQueue jobs;
    private final WorkerShutdown workers;
    private final RegenerationPolicy policy;
    private final Clock clock;
    private final boolean reconciling;
    private final ResultsReportWriter reportWriter;

    @Getter
    private final ReconciliationTable table = new ReconciliationTable();
    @Getter
    private final CompletableFuture<ReconciliationTable> completion = new CompletableFuture<>();
    private boolean shutdownSent;
    @Getter
    private int rounds;

    /**
     * @param reconciling when false the table is only kept and reported; no bucket is regenerated
     *                    and the workers are never told to stop from here
     */
    public Reconciler(OutcomeChannel outcomes, JobQueue jobs, WorkerShutdown workers, RegenerationPolicy policy,
                      Clock clock, boolean reconciling, ResultsReportWriter reportWriter) {
        this.outcomes = outcomes;
        this.jobs = jobs;
        this.workers = workers;
        this.policy = policy;
        this.clock = clock;
        this.reconciling = reconciling;
        this.reportWriter = reportWriter;
    }

    @Override
    public void run() {
        try {
            while (true) {
                var next = outcomes.take();
                if (next.isEmpty()) {
                    log.info("Got shutdown signal, writing results for {} buckets", table.size());
                    break;
                }
                onEvent(next.get());
            }
            reportWriter.write(table.toReportLines());
            completion.complete(table);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Reconciler interrupted");
            completion.completeExceptionally(e);
        } catch (IOException | RuntimeException e) {
            log.error("Reconciler failed", e);
            completion.completeExceptionally(e);
        }
    }

    void onEvent(OutcomeEvent event) throws InterruptedException {
        log.debug("Got result: {}", event);
        table.apply(event);
        if (!reconciling || shutdownSent || !table.isComplete()) {
            return;
        }
        rounds++;
        var currentMonth = BucketKey.current(clock);
        var decision = policy.decide(table.getStates(), currentMonth);
        log.info("All {} buckets reconciled (round {}), total discrepancy {} excluding {}",
            table.size(), rounds, decision.totalDiscrepancy(), currentMonth);

        if (decision.isShutdown()) {
            log.info("No bucket to regenerate, stopping workers");
            shutdownSent = true;
            workers.signalShutdown();
            return;
        }
        for (BucketKey bucket : decision.regenerate()) {
            var state = table.get(bucket);
            log.atWarn().setMessage("Regenerating {}: expected {}, final {}, diff {}{}")
                .addArgument(bucket)
                .addArgument(state::getExpected)
                .addArgument(state::getFinalCount)
                .addArgument(state::getDiff)
                .addArgument(() -> state.isFailed() ? " (failed)" : "")
                .log();
            table.reset(bucket);
            jobs.put(Job.regenerate(bucket));
        }
    }
}
