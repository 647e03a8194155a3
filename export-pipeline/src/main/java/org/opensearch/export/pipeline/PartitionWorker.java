package org.opensearch.export.pipeline;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.opensearch.export.pipeline.ir.Job;
import org.opensearch.export.pipeline.ir.OutcomeEvent;
import org.opensearch.export.pipeline.output.ManifestWriter;
import org.opensearch.export.pipeline.output.RotatingSequenceWriter;
import org.opensearch.export.pipeline.output.SummaryCsvWriter;
import org.opensearch.export.pipeline.output.SummaryRow;
import org.opensearch.export.pipeline.serializer.RecordSerializer;
import org.opensearch.export.source.PagedResultStream;
import org.opensearch.export.source.RecordSearchClient;
import org.opensearch.export.source.SearchRecord;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Takes jobs off the queue until it receives a stop entry, exporting each job's month.
 *
 * <p>Every record of the month goes into the summary CSV. Only findable records are serialized
 * into the sequence files, which rotate every {@code rotationThreshold} records read. When the
 * month is exhausted the worker reports a {@code FINAL} count. Jobs without an expected count get
 * one from the index first, reported as {@code EXPECTED}.</p>
 *
 * <p>Any failure while exporting a job, {@link Error}s included, ends the worker with a
 * {@link FatalWorkerException} naming the job; there is no retry at this level.</p>
 */
@Slf4j
public class PartitionWorker implements Runnable {
    static final int DEBUG_PROGRESS_INTERVAL = 10_000;
    static final int INFO_PROGRESS_INTERVAL = 100_000;
    static final long LARGE_BUCKET_THRESHOLD = 1_000_000;

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String workerId;
    private final JobQueue jobs;
    private final OutcomeChannel outcomes;
    private final RecordSearchClient searchClient;
    private final RecordSerializer serializer;
    private final ExportSettings settings;

    public PartitionWorker(String workerId, JobQueue jobs, OutcomeChannel outcomes, RecordSearchClient searchClient,
                           RecordSerializer serializer, ExportSettings settings) {
        this.workerId = workerId;
        this.jobs = jobs;
        this.outcomes = outcomes;
        this.searchClient = searchClient;
        this.serializer = serializer;
        this.settings = settings;
    }

    @Override
    public void run() {
        log.debug("Worker {} started", workerId);
        while (true) {
            Job job;
            try {
                var next = jobs.take();
                if (next.isEmpty()) {
                    log.info("Worker {} received stop signal, stopping", workerId);
                    return;
                }
                job = next.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Worker {} interrupted while waiting for a job, stopping", workerId);
                return;
            }
            long count;
            try {
                count = export(job);
            } catch (FatalWorkerException e) {
                throw e;
            } catch (RuntimeException | Error e) {
                // an in-flight job must always produce an outcome
                throw fatal(job, "failed unexpectedly on " + job.bucket(), e);
            }
            outcomes.publish(OutcomeEvent.finalCount(job.bucket(), count));
            jobs.markDone();
        }
    }

    /**
     * Exports one month.
     *
     * @return the number of records read for the month
     */
    long export(Job job) {
        var bucket = job.bucket();
        log.info("Worker {} started processing {} with expected count {}", workerId, bucket,
            job.hasExpectedCount() ? job.expectedCount() : "unknown");

        var directory = settings.getOutputRoot().resolve(ManifestWriter.DATA_DIRECTORY)
            .resolve(bucket.directoryName());
        try {
            Files.createDirectories(directory);
            removePreviousParts(directory);
        } catch (IOException e) {
            throw fatal(job, "failed to prepare output directory " + directory, e);
        }

        var query = settings.getBaseQuery().withUpdatedRange(bucket.rangeStart(), bucket.rangeEnd());
        long expected;
        if (job.hasExpectedCount()) {
            expected = job.expectedCount();
        } else {
            try {
                expected = searchClient.count(query);
            } catch (IOException | RuntimeException e) {
                throw fatal(job, "failed to count records for " + bucket, e);
            }
            outcomes.publish(OutcomeEvent.expected(bucket, expected));
        }

        long count = 0;
        long exported = 0;
        var summaryPath = directory.resolve(SummaryCsvWriter.fileName(bucket.toString()));
        try (var sequence = new RotatingSequenceWriter(directory);
             var summary = new SummaryCsvWriter(summaryPath)) {
            var records = new PagedResultStream(searchClient, query, settings.getPageSize(),
                settings.getRetryBackoff(), settings.getSleeper());
            for (SearchRecord record : records) {
                count++;
                summary.write(SummaryRow.of(record));
                if (record.isFindable()) {
                    sequence.write(objectMapper.writeValueAsString(serializer.serialize(record)));
                    exported++;
                }

                if (expected > LARGE_BUCKET_THRESHOLD && count % INFO_PROGRESS_INTERVAL == 0) {
                    log.info("Worker {} processed {}/{} records for {}", workerId, count, expected, bucket);
                }
                if (count % DEBUG_PROGRESS_INTERVAL == 0) {
                    log.debug("Worker {} processed {}/{} records for {}", workerId, count, expected, bucket);
                }
                if (count % settings.getRotationThreshold() == 0) {
                    sequence.rotate();
                }
            }
        } catch (IOException | RuntimeException e) {
            throw fatal(job, "failed to export " + bucket + " after " + count + " records", e);
        }

        log.atInfo().setMessage("Worker {} finished {} with final count {} ({} findable, expected {})")
            .addArgument(workerId)
            .addArgument(bucket)
            .addArgument(count)
            .addArgument(exported)
            .addArgument(expected)
            .log();
        return count;
    }

    private static void removePreviousParts(Path directory) throws IOException {
        try (DirectoryStream<Path> parts = Files.newDirectoryStream(directory, "part_*.jsonl.gz")) {
            for (Path part : parts) {
                Files.delete(part);
            }
        }
    }

    private FatalWorkerException fatal(Job job, String message, Throwable cause) {
        log.atError().setMessage("Worker {} {}")
            .addArgument(workerId)
            .addArgument(message)
            .setCause(cause)
            .log();
        return new FatalWorkerException(job, "Worker " + workerId + " " + message, cause);
    }
}
