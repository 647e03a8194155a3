package org.opensearch.export.pipeline;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.opensearch.export.pipeline.ir.OutcomeEvent;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Fixed set of worker slots, each on its own {@code worker-<i>} thread.
 *
 * <p>A slot supervises the worker it runs. When the worker dies with a
 * {@link FatalWorkerException} the slot marks the job done, reports the bucket as
 * {@code FAILED} and carries on with a fresh worker, so the pool never loses capacity and every
 * job taken off the queue produces an outcome.</p>
 */
@Slf4j
public class WorkerPool implements WorkerShutdown {
    public static final String WORKER_ID_MDC_KEY = "workerId";

    @Getter
    private final int size;
    private final JobQueue jobs;
    private final OutcomeChannel outcomes;
    private final Function<String, Runnable> workerFactory;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean shutdownSignalled = new AtomicBoolean();
    private final AtomicInteger restarts = new AtomicInteger();
    private ExecutorService executor;

    /**
     * @param workerFactory creates the worker for a slot, given the worker id
     */
    public WorkerPool(int size, JobQueue jobs, OutcomeChannel outcomes, Function<String, Runnable> workerFactory) {
        if (size < 1) {
            throw new IllegalArgumentException("Worker pool needs at least one worker, got " + size);
        }
        this.size = size;
        this.jobs = jobs;
        this.outcomes = outcomes;
        this.workerFactory = workerFactory;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker pool already started");
        }
        executor = Executors.newFixedThreadPool(size, namedThreads());
        for (int i = 0; i < size; i++) {
            var workerId = "worker-" + i;
            executor.execute(() -> supervise(workerId));
        }
        executor.shutdown();
        log.info("Started {} workers", size);
    }

    private void supervise(String workerId) {
        MDC.put(WORKER_ID_MDC_KEY, workerId);
        try {
            while (true) {
                try {
                    workerFactory.apply(workerId).run();
                    return;
                } catch (FatalWorkerException e) {
                    var bucket = e.getJob().bucket();
                    log.atError().setMessage("Worker {} died on {}, reporting it failed and restarting")
                        .addArgument(workerId)
                        .addArgument(bucket)
                        .log();
                    jobs.markDone();
                    outcomes.publish(OutcomeEvent.failed(bucket));
                    restarts.incrementAndGet();
                }
            }
        } catch (RuntimeException | Error e) {
            log.error("Worker slot " + workerId + " stopped unexpectedly", e);
            throw e;
        } finally {
            MDC.remove(WORKER_ID_MDC_KEY);
        }
    }

    /** Enqueues one stop entry per worker. Only the first call has any effect. */
    @Override
    public void signalShutdown() throws InterruptedException {
        if (!shutdownSignalled.compareAndSet(false, true)) {
            log.debug("Shutdown already signalled");
            return;
        }
        log.info("Signalling {} workers to stop", size);
        for (int i = 0; i < size; i++) {
            jobs.putStop();
        }
    }

    public boolean isShutdownSignalled() {
        return shutdownSignalled.get();
    }

    /** Number of times a slot replaced a dead worker. */
    public int getRestartCount() {
        return restarts.get();
    }

    /**
     * Waits for every slot to stop.
     *
     * @return true if they stopped within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (executor == null) {
            return true;
        }
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static ThreadFactory namedThreads() {
        var counter = new AtomicInteger();
        return runnable -> new Thread(runnable, "worker-" + counter.getAndIncrement());
    }
}
