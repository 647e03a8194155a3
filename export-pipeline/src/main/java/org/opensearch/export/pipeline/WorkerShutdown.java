package org.opensearch.export.pipeline;

/** Tells every worker to stop once it runs out of queued jobs. */
@FunctionalInterface
public interface WorkerShutdown {
    void signalShutdown() throws InterruptedException;
}
