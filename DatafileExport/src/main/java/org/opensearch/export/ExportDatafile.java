package org.opensearch.export;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import org.opensearch.export.pipeline.ExportSettings;
import org.opensearch.export.pipeline.JobQueue;
import org.opensearch.export.pipeline.ir.BucketKey;
import org.opensearch.export.pipeline.serializer.DoiRecordSerializer;
import org.opensearch.export.source.OpenSearchRecordClient;
import org.opensearch.export.source.PagedResultStreamException;
import org.opensearch.export.source.RecordSearchClient;
import org.opensearch.export.source.http.ConnectionContext;
import org.opensearch.export.source.http.ReactorNettyRestClient;
import org.opensearch.export.storage.BulkStorage;
import org.opensearch.export.storage.FileBulkStorage;
import org.opensearch.export.storage.s3.S3BulkStorage;
import org.opensearch.export.storage.s3.S3Uri;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import lombok.extern.slf4j.Slf4j;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;

/**
 * Command line entry point: exports every month of DOI records from the search cluster into
 * per-month gzip files, reconciles the exported counts and uploads the result.
 */
@Slf4j
public class ExportDatafile {
    public static final int INVALID_ARGS_EXIT_CODE = 1;
    public static final int EXPORT_FAILED_EXIT_CODE = 2;
    public static final int UPLOAD_FAILED_EXIT_CODE = 4;

    public static final String ENV_PREFIX = "EXPORT_";
    public static final String CONSOLE_LEVEL_PROPERTY = "export.consoleLevel";
    private static final String PROGRAM_NAME = "export-datafile";
    private static final String REDACTED = "*****";

    public static class DurationConverter implements IStringConverter<Duration> {
        @Override
        public Duration convert(String value) {
            try {
                return Duration.parse(value);
            } catch (RuntimeException e) {
                throw new ParameterException("Invalid ISO-8601 duration: " + value, e);
            }
        }
    }

    public static class Args {
        @Parameter(
            names = {"--help", "-h"},
            help = true,
            description = "Displays information about how to use this tool")
        boolean help;

        @Parameter(required = false,
            names = {"--verbose", "-v"},
            description = "Optional. Log debug messages to the console as well as the log file")
        public boolean verbose = false;

        @Parameter(required = false,
            names = {"--opensearch-url", "--opensearchUrl"},
            description = "Optional. URL of the cluster holding the records. Default: http://localhost:9200")
        public String opensearchUrl = "http://localhost:9200";

        @Parameter(required = false,
            names = {"--index"},
            description = "Optional. Name of the index holding the records. Default: dois")
        public String index = "dois";

        @Parameter(required = false,
            names = {"--username"},
            description = "Optional. Basic auth username for the cluster. Requires --password")
        public String username = null;

        @Parameter(required = false,
            names = {"--password"},
            description = "Optional. Basic auth password for the cluster. Requires --username")
        public String password = null;

        @Parameter(required = false,
            names = {"--insecure"},
            description = "Optional. Skip certificate validation when the cluster uses https")
        public boolean insecure = false;

        @Parameter(required = false,
            names = {"--request-timeout", "--requestTimeout"},
            converter = DurationConverter.class,
            description = "Optional. How long to wait for a response from the cluster. Default: PT2M")
        public Duration requestTimeout = Duration.ofMinutes(2);

        @Parameter(required = false,
            names = {"--search-timeout", "--searchTimeout"},
            description = "Optional. Server side timeout for each search, like 60s. Default: the cluster's")
        public String searchTimeout = null;

        @Parameter(required = false,
            names = {"--output-path", "--outputPath"},
            description = "Optional. Local directory the export is written to. Default: ./data")
        public String outputPath = "./data";

        @Parameter(required = false,
            names = {"--results-file", "--resultsFile"},
            description = "Optional. Where the reconciliation report goes. Default: <output-path>/results.csv")
        public String resultsFile = null;

        @Parameter(required = false,
            names = {"--workers"},
            description = "Optional. Number of months exported at the same time. Default: 32")
        public int workers = 32;

        @Parameter(required = false,
            names = {"--page-size", "--pageSize"},
            description = "Optional. Records fetched per search request. Default: 1000")
        public int pageSize = 1000;

        @Parameter(required = false,
            names = {"--rotation-threshold", "--rotationThreshold"},
            description = "Optional. Records per data file before starting the next one. Default: 10000")
        public int rotationThreshold = 10_000;

        @Parameter(required = false,
            names = {"--retry-backoff", "--retryBackoff"},
            converter = DurationConverter.class,
            description = "Optional. Wait between retries of a failed or timed out search. Default: PT10S")
        public Duration retryBackoff = Duration.ofSeconds(10);

        @Parameter(required = false,
            names = {"--total-discrepancy-threshold", "--totalDiscrepancyThreshold"},
            description = "Optional. Summed difference between expected and exported counts, over all "
                + "months but the current one, above which months are regenerated. Default: 1000")
        public long totalDiscrepancyThreshold = 1000;

        @Parameter(required = false,
            names = {"--month-discrepancy-threshold", "--monthDiscrepancyThreshold"},
            description = "Optional. Difference for a single month above which it is regenerated. Default: 100")
        public long monthDiscrepancyThreshold = 100;

        @Parameter(required = false,
            names = {"--max-regenerations", "--maxRegenerations"},
            description = "Optional. How many times one month may be regenerated. Default: 3")
        public int maxRegenerations = 3;

        @Parameter(required = false,
            names = {"--job-queue-capacity", "--jobQueueCapacity"},
            description = "Optional. Jobs that may wait for a worker at once. Default: 256")
        public int jobQueueCapacity = JobQueue.DEFAULT_CAPACITY;

        @Parameter(required = false,
            names = {"--from"},
            description = "Optional. First month to export, as YYYY-MM")
        public String from = null;

        @Parameter(required = false,
            names = {"--to"},
            description = "Optional. Last month to export, as YYYY-MM")
        public String to = null;

        @Parameter(required = false,
            names = {"--month"},
            description = "Optional. Export only this month, as YYYY-MM. Mutually exclusive with --from and --to")
        public String month = null;

        @Parameter(required = false,
            names = {"--no-reconcile", "--noReconcile"},
            description = "Optional. Export each month once and only report the counts")
        public boolean noReconcile = false;

        @Parameter(required = false,
            names = {"--local-only", "--localOnly"},
            description = "Optional. Keep the export on local disk and skip the upload")
        public boolean localOnly = false;

        @Parameter(required = false,
            names = {"--target-s3-uri", "--targetS3Uri"},
            description = "The S3 URI to upload to, like: s3://my-bucket/datafile. "
                + "Mutually exclusive with --target-dir")
        public String targetS3Uri = null;

        @Parameter(required = false,
            names = {"--s3-region", "--s3Region"},
            description = "Optional. The AWS Region of the target bucket, like: us-east-2")
        public String s3Region = null;

        @Parameter(required = false,
            names = {"--s3-endpoint", "--s3Endpoint"},
            description = "Optional. The endpoint URL to use for S3 calls. "
                + "For use when the default AWS ones won't work for a particular context.")
        public String s3Endpoint = null;

        @Parameter(required = false,
            names = {"--target-dir", "--targetDir"},
            description = "Local directory to upload to instead of S3. Mutually exclusive with --target-s3-uri")
        public String targetDir = null;

        BucketKey fromMonth() {
            return month != null ? BucketKey.parse(month) : from == null ? null : BucketKey.parse(from);
        }

        BucketKey toMonth() {
            return month != null ? BucketKey.parse(month) : to == null ? null : BucketKey.parse(to);
        }
    }

    public static void validateArgs(Args args) {
        if (args.month != null && (args.from != null || args.to != null)) {
            throw new ParameterException("--month cannot be combined with --from or --to");
        }
        BucketKey from;
        BucketKey to;
        try {
            from = args.fromMonth();
            to = args.toMonth();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(e.getMessage(), e);
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new ParameterException("--from " + from + " is after --to " + to);
        }

        if (args.workers < 1 || args.pageSize < 1 || args.rotationThreshold < 1 || args.jobQueueCapacity < 1) {
            throw new ParameterException(
                "--workers, --page-size, --rotation-threshold and --job-queue-capacity must be at least 1");
        }
        if (args.maxRegenerations < 0 || args.totalDiscrepancyThreshold < 0 || args.monthDiscrepancyThreshold < 0) {
            throw new ParameterException("Discrepancy thresholds and --max-regenerations cannot be negative");
        }
        if ((args.username == null) != (args.password == null)) {
            throw new ParameterException("--username and --password must be provided together");
        }

        if (args.localOnly) {
            if (args.targetS3Uri != null || args.targetDir != null) {
                log.warn("--local-only given, ignoring the upload target");
            }
            return;
        }
        if (args.targetS3Uri != null && args.targetDir != null) {
            throw new ParameterException("You must provide either --target-s3-uri or --target-dir, but not both.");
        }
        if (args.targetS3Uri == null && args.targetDir == null) {
            throw new ParameterException(
                "You must provide either --target-s3-uri or --target-dir, or skip the upload with --local-only.");
        }
        if (args.targetS3Uri != null) {
            try {
                S3Uri.parse(args.targetS3Uri);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(e.getMessage(), e);
            }
        } else if (args.s3Region != null || args.s3Endpoint != null) {
            throw new ParameterException("--s3-region and --s3-endpoint only apply with --target-s3-uri");
        }
    }

    public static void main(String[] args) throws Exception {
        System.err.println("Starting program with: " + String.join(" ", redactArgs(args)));
        int exitCode;
        try {
            exitCode = run(args, System::getenv);
        } finally {
            LogManager.shutdown();
        }
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] argv, UnaryOperator<String> env) throws Exception {
        var arguments = new Args();
        var jCommander = JCommander.newBuilder().addObject(arguments).programName(PROGRAM_NAME).build();
        try {
            EnvVarParameterPuller.injectFromEnv(arguments, ENV_PREFIX, env);
            jCommander.parse(argv);
            if (arguments.help) {
                jCommander.usage();
                return 0;
            }
            validateArgs(arguments);
        } catch (ParameterException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            jCommander.usage();
            return INVALID_ARGS_EXIT_CODE;
        }
        if (arguments.verbose) {
            enableConsoleDebug();
        }

        try (var searchClient = createSearchClient(arguments);
             var storage = createStorage(arguments)) {
            var result = buildOrchestrator(arguments, searchClient, storage).run();
            return exitCodeFor(result);
        } catch (PagedResultStreamException | IOException e) {
            log.error("Export failed", e);
            return EXPORT_FAILED_EXIT_CODE;
        }
    }

    static ExportOrchestrator buildOrchestrator(Args arguments, RecordSearchClient searchClient,
                                                BulkStorage storage) {
        var outputRoot = Path.of(arguments.outputPath);
        var settings = ExportSettings.builder()
            .outputRoot(outputRoot)
            .pageSize(arguments.pageSize)
            .rotationThreshold(arguments.rotationThreshold)
            .retryBackoff(arguments.retryBackoff)
            .totalDiscrepancyThreshold(arguments.totalDiscrepancyThreshold)
            .monthDiscrepancyThreshold(arguments.monthDiscrepancyThreshold)
            .maxRegenerations(arguments.maxRegenerations)
            .build();
        return ExportOrchestrator.builder()
            .searchClient(searchClient)
            .serializer(new DoiRecordSerializer())
            .settings(settings)
            .workers(arguments.workers)
            .jobQueueCapacity(arguments.jobQueueCapacity)
            .reconcile(!arguments.noReconcile)
            .from(arguments.fromMonth())
            .to(arguments.toMonth())
            .resultsFile(arguments.resultsFile == null ? null : Path.of(arguments.resultsFile))
            .storage(storage)
            .uploadTarget(storage == null ? null : uploadTarget(arguments))
            .build();
    }

    static int exitCodeFor(ExportResult result) {
        log.atInfo().setMessage("Exported {} records in {} months after {} reconciliation rounds")
            .addArgument(result::exportedRecordCount)
            .addArgument(() -> result.report().size())
            .addArgument(result::reconciliationRounds)
            .log();
        if (result.workerRestarts() > 0) {
            log.warn("{} workers died and were restarted", result.workerRestarts());
        }
        long failedUploads = result.failedUploadCount();
        if (failedUploads > 0) {
            log.error("{} of {} storage operations failed", failedUploads,
                result.removals().size() + result.uploads().size());
            return UPLOAD_FAILED_EXIT_CODE;
        }
        return 0;
    }

    static List<String> redactArgs(String[] args) {
        List<String> redacted = new ArrayList<>(args.length);
        boolean redactNext = false;
        for (String arg : args) {
            if (redactNext) {
                redacted.add(REDACTED);
                redactNext = false;
            } else if (arg.startsWith("--password=")) {
                redacted.add("--password=" + REDACTED);
            } else {
                redacted.add(arg);
                redactNext = arg.equals("--password");
            }
        }
        return redacted;
    }

    private static String uploadTarget(Args arguments) {
        return arguments.targetS3Uri != null ? arguments.targetS3Uri : arguments.targetDir;
    }

    private static RecordSearchClient createSearchClient(Args arguments) {
        var connectionContext = ConnectionContext.builder()
            .url(arguments.opensearchUrl)
            .insecure(arguments.insecure)
            .username(arguments.username)
            .password(arguments.password)
            .compressionSupported(true)
            .build();
        log.info("Reading records from {} index {}", connectionContext, arguments.index);
        // one connection per worker plus one for the histogram and counts
        var restClient = new ReactorNettyRestClient(connectionContext, arguments.workers + 1);
        return new OpenSearchRecordClient(restClient, arguments.index, arguments.requestTimeout,
            arguments.searchTimeout);
    }

    private static BulkStorage createStorage(Args arguments) {
        if (arguments.localOnly) {
            log.info("Local only, nothing will be uploaded");
            return null;
        }
        if (arguments.targetS3Uri != null) {
            var endpoint = arguments.s3Endpoint == null ? null : URI.create(arguments.s3Endpoint);
            return new S3BulkStorage(arguments.s3Region, endpoint);
        }
        return new FileBulkStorage();
    }

    private static void enableConsoleDebug() {
        System.setProperty(CONSOLE_LEVEL_PROPERTY, "DEBUG");
        LoggerContext.getContext(false).reconfigure();
        log.debug("Console logging at DEBUG");
    }
}
