package org.opensearch.export.source;

import java.time.Duration;

/**
 * Blocks the calling thread between retries.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
