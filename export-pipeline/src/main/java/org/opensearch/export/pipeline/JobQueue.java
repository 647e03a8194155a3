package org.opensearch.export.pipeline;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Phaser;

import org.opensearch.export.pipeline.ir.Job;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded FIFO of export jobs shared by all workers.
 *
 * <p>Besides jobs the queue carries stop entries; each one ends exactly one consumer. Every job
 * put on the queue stays in flight until a consumer calls {@link #markDone()} for it, which is
 * what {@link #awaitDrained()} waits on.</p>
 */
@Slf4j
public class JobQueue {
    public static final int DEFAULT_CAPACITY = 256;

    private static final Entry STOP = new Entry(null);

    private final BlockingQueue<Entry> entries;
    // One party for the waiter plus one per job in flight
    private final Phaser inFlight = new Phaser(1);

    private record Entry(Job job) {}

    public JobQueue() {
        this(DEFAULT_CAPACITY);
    }

    public JobQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Job queue capacity must be positive, was " + capacity);
        }
        this.entries = new LinkedBlockingQueue<>(capacity);
    }

    /** Blocks while the queue is full. */
    public void put(Job job) throws InterruptedException {
        inFlight.register();
        try {
            entries.put(new Entry(job));
        } catch (InterruptedException e) {
            inFlight.arriveAndDeregister();
            throw e;
        }
        log.atDebug().setMessage("Queued job for {}").addArgument(job::bucket).log();
    }

    /** Enqueues one stop entry. */
    public void putStop() throws InterruptedException {
        entries.put(STOP);
    }

    /**
     * Blocks until an entry is available.
     *
     * @return the next job, or empty when the consumer should stop
     */
    public Optional<Job> take() throws InterruptedException {
        return Optional.ofNullable(entries.take().job());
    }

    /** Marks one previously taken job as finished, successfully or not. */
    public void markDone() {
        inFlight.arriveAndDeregister();
    }

    /** Blocks until every job put so far has been marked done. */
    public void awaitDrained() throws InterruptedException {
        int phase = inFlight.arrive();
        inFlight.awaitAdvanceInterruptibly(phase);
    }

    public int getInFlightCount() {
        return inFlight.getRegisteredParties() - 1;
    }
}
