package org.opensearch.export;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

import org.opensearch.export.pipeline.ExportSettings;
import org.opensearch.export.pipeline.JobQueue;
import org.opensearch.export.pipeline.OutcomeChannel;
import org.opensearch.export.pipeline.PartitionWorker;
import org.opensearch.export.pipeline.ReconciliationTable;
import org.opensearch.export.pipeline.Reconciler;
import org.opensearch.export.pipeline.RegenerationPolicy;
import org.opensearch.export.pipeline.WorkerPool;
import org.opensearch.export.pipeline.ir.BucketKey;
import org.opensearch.export.pipeline.ir.Job;
import org.opensearch.export.pipeline.ir.OutcomeEvent;
import org.opensearch.export.pipeline.output.ManifestWriter;
import org.opensearch.export.pipeline.output.ResultsReportWriter;
import org.opensearch.export.pipeline.serializer.RecordSerializer;
import org.opensearch.export.source.MonthlyHistogram;
import org.opensearch.export.source.RecordQuery;
import org.opensearch.export.source.RecordSearchClient;
import org.opensearch.export.storage.BulkStorage;
import org.opensearch.export.storage.PutResult;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one export from the monthly histogram to the uploaded manifest.
 *
 * <p>Every month in the histogram (restricted to {@code from}..{@code to} when given) becomes a
 * job. Its expected count is published before the workers start, so the reconciler knows the
 * whole table up front. When reconciling, the reconciler decides when the workers stop; otherwise
 * they are stopped once the queue drains. After the workers and then the reconciler have finished,
 * the manifest is written and, if a storage target is set, the target is emptied and refilled.</p>
 */
@Slf4j
@Builder
public class ExportOrchestrator {
    public static final String RESULTS_FILE_NAME = "results.csv";
    public static final String GZIP_CONTENT_TYPE = "application/gzip";
    public static final String MANIFEST_CONTENT_TYPE = "text/plain";
    private static final Duration PROGRESS_INTERVAL = Duration.ofMinutes(1);

    @NonNull
    private final RecordSearchClient searchClient;
    @NonNull
    private final RecordSerializer serializer;
    @NonNull
    private final ExportSettings settings;
    @Builder.Default
    private final int workers = 32;
    @Builder.Default
    private final int jobQueueCapacity = JobQueue.DEFAULT_CAPACITY;
    @Builder.Default
    private final boolean reconcile = true;
    private final BucketKey from;
    private final BucketKey to;
    /** Defaults to {@code results.csv} under the output root. */
    private final Path resultsFile;
    /** No upload when null. */
    private final BulkStorage storage;
    private final String uploadTarget;

    public ExportResult run() throws IOException, InterruptedException {
        if (storage != null && uploadTarget == null) {
            throw new IllegalStateException("An upload target is required when storage is set");
        }
        var outputRoot = settings.getOutputRoot();
        Files.createDirectories(outputRoot);

        var histogram = searchClient.monthlyHistogram(buildQuery());
        var buckets = selectBuckets(histogram);
        long expectedTotal = buckets.values().stream().mapToLong(Long::longValue).sum();
        log.atInfo().setMessage("Expecting {} records across {} months ({} total hits)")
            .addArgument(expectedTotal)
            .addArgument(buckets.size())
            .addArgument(histogram.totalHits())
            .log();

        var reportWriter = new ResultsReportWriter(resultsFile != null ? resultsFile
            : outputRoot.resolve(RESULTS_FILE_NAME));
        ReconciliationTable table;
        int rounds = 0;
        int restarts = 0;
        if (buckets.isEmpty()) {
            log.warn("No months to export, writing an empty report");
            table = new ReconciliationTable();
            reportWriter.write(table.toReportLines());
        } else {
            var jobs = new JobQueue(jobQueueCapacity);
            var outcomes = new OutcomeChannel();
            var pool = new WorkerPool(workers, jobs, outcomes, workerId ->
                new PartitionWorker(workerId, jobs, outcomes, searchClient, serializer, settings));
            var reconciler = new Reconciler(outcomes, jobs, pool, RegenerationPolicy.from(settings),
                settings.getClock(), reconcile, reportWriter);
            reconciler.getCompletion().whenComplete((done, error) -> {
                if (error != null) {
                    stopAfterReconcilerFailure(pool);
                }
            });

            for (var bucket : buckets.entrySet()) {
                outcomes.publish(OutcomeEvent.expected(bucket.getKey(), bucket.getValue()));
            }
            var reconcilerThread = new Thread(reconciler, "reconciler");
            reconcilerThread.start();
            pool.start();
            for (var bucket : buckets.entrySet()) {
                jobs.put(new Job(bucket.getKey(), bucket.getValue()));
            }
            log.info("Queued {} jobs for {} workers", buckets.size(), workers);

            if (!reconcile) {
                jobs.awaitDrained();
                log.info("All jobs done, stopping workers");
                pool.signalShutdown();
            }
            while (!pool.awaitTermination(PROGRESS_INTERVAL)) {
                log.info("Still exporting, {} jobs in flight", jobs.getInFlightCount());
            }
            log.info("Workers stopped, waiting for the results report");
            outcomes.signalShutdown();
            try {
                table = reconciler.getCompletion().get();
            } catch (ExecutionException e) {
                throw new IOException("Reconciliation did not complete", e.getCause());
            }
            reconcilerThread.join();
            rounds = reconciler.getRounds();
            restarts = pool.getRestartCount();
        }

        var manifest = new ManifestWriter(outputRoot).write();
        List<PutResult> removals = List.of();
        List<PutResult> uploads = List.of();
        if (storage != null) {
            removals = emptyTarget();
            uploads = upload(outputRoot, manifest);
        }
        return new ExportResult(table.toReportLines(), manifest, removals, uploads, rounds, restarts);
    }

    RecordQuery buildQuery() {
        var query = settings.getBaseQuery();
        if (from == null && to == null) {
            return query;
        }
        return query.withUpdatedRange(from == null ? null : from.rangeStart(), to == null ? null : to.rangeEnd());
    }

    Map<BucketKey, Long> selectBuckets(MonthlyHistogram histogram) {
        Map<BucketKey, Long> selected = new TreeMap<>();
        for (var bucket : histogram.buckets()) {
            var key = BucketKey.parse(bucket.key());
            if ((from != null && key.isBefore(from)) || (to != null && key.isAfter(to))) {
                log.debug("Skipping {} outside the requested range", key);
                continue;
            }
            selected.put(key, bucket.docCount());
        }
        return selected;
    }

    private List<PutResult> emptyTarget() throws IOException {
        log.info("Emptying {}", uploadTarget);
        var removals = storage.empty(uploadTarget);
        long failed = removals.stream().filter(r -> !r.success()).count();
        if (failed > 0) {
            log.error("{} of {} objects could not be removed from {}", failed, removals.size(), uploadTarget);
        }
        return removals;
    }

    private List<PutResult> upload(Path outputRoot, List<ManifestWriter.Entry> manifest) {
        var files = manifest.stream().map(ManifestWriter.Entry::path).collect(Collectors.toList());
        log.info("Uploading {} files to {}", files.size() + 1, uploadTarget);
        List<PutResult> results = new ArrayList<>(storage.put(outputRoot, files, uploadTarget, GZIP_CONTENT_TYPE));
        results.addAll(storage.put(outputRoot, List.of(ManifestWriter.MANIFEST_FILE_NAME), uploadTarget,
            MANIFEST_CONTENT_TYPE));

        long failed = 0;
        for (PutResult result : results) {
            if (result.success()) {
                log.debug("Uploaded {}", result.file());
            } else {
                failed++;
                log.error("Failed to upload {}: {}", result.file(), result.message());
            }
        }
        log.info("Upload finished: {} files, {} failed", results.size(), failed);
        return results;
    }

    private static void stopAfterReconcilerFailure(WorkerPool pool) {
        log.error("Reconciler stopped before the export finished, stopping workers");
        try {
            pool.signalShutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping workers");
        }
    }
}
