package org.opensearch.export.pipeline;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import org.opensearch.export.source.PagedResultStream;
import org.opensearch.export.source.RecordQuery;
import org.opensearch.export.source.Sleeper;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Tuning shared by the workers and the reconciler of one export run. */
@Value
@Builder(toBuilder = true)
public class ExportSettings {
    @NonNull
    Path outputRoot;
    @Builder.Default
    RecordQuery baseQuery = RecordQuery.defaults();
    @Builder.Default
    int pageSize = PagedResultStream.DEFAULT_PAGE_SIZE;
    @Builder.Default
    int rotationThreshold = 10_000;
    @Builder.Default
    Duration retryBackoff = PagedResultStream.DEFAULT_BACKOFF;
    @Builder.Default
    Sleeper sleeper = Sleeper.THREAD_SLEEP;
    @Builder.Default
    long totalDiscrepancyThreshold = 1000;
    @Builder.Default
    long monthDiscrepancyThreshold = 100;
    @Builder.Default
    int maxRegenerations = 3;
    @Builder.Default
    Clock clock = Clock.systemUTC();
}
