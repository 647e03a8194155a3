package org.opensearch.export.pipeline;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import org.opensearch.export.pipeline.ir.OutcomeEvent;

/**
 * Unbounded channel carrying outcome events from workers and the orchestrator to the reconciler,
 * plus a shutdown signal that ends the reconciler.
 */
public class OutcomeChannel {
    private static final Message SHUTDOWN = new Message(null);

    private final BlockingQueue<Message> messages = new LinkedBlockingQueue<>();

    private record Message(OutcomeEvent event) {}

    public void publish(OutcomeEvent event) {
        messages.add(new Message(event));
    }

    public void signalShutdown() {
        messages.add(SHUTDOWN);
    }

    /**
     * @return the next event, or empty once the shutdown signal is reached
     */
    public Optional<OutcomeEvent> take() throws InterruptedException {
        return Optional.ofNullable(messages.take().event());
    }
}
