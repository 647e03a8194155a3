package org.opensearch.export.storage.s3;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

import org.opensearch.export.storage.BulkStorage;
import org.opensearch.export.storage.PutResult;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Error;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * BulkStorage backed by Amazon S3. The target is an {@code s3://bucket/prefix} URI and every file
 * becomes the object {@code prefix/<relative path>}.
 */
@Slf4j
public class S3BulkStorage implements BulkStorage {
    static final int MAX_CONCURRENT_UPLOADS = 32;
    static final int MAX_KEYS_PER_DELETE = 1000;

    private static final double S3_TARGET_THROUGHPUT_GIBPS = 8.0;
    private static final long S3_MAX_MEMORY_BYTES = 1024L * 1024 * 1024; // 1GB
    private static final long S3_MINIMUM_PART_SIZE_BYTES = 8L * 1024 * 1024; // 8MB

    private final S3AsyncClient s3Client;

    /**
     * @param region the AWS region, or null to use the default provider chain
     * @param endpoint custom S3 endpoint (for testing with LocalStack, etc.), or null
     */
    public S3BulkStorage(String region, URI endpoint) {
        this(buildClient(region, endpoint));
    }

    public S3BulkStorage(S3AsyncClient s3Client) {
        this.s3Client = s3Client;
    }

    private static S3AsyncClient buildClient(String region, URI endpoint) {
        var clientBuilder = S3AsyncClient.crtBuilder()
            .credentialsProvider(DefaultCredentialsProvider.builder().build())
            .retryConfiguration(r -> r.numRetries(3))
            .targetThroughputInGbps(S3_TARGET_THROUGHPUT_GIBPS)
            .maxNativeMemoryLimitInBytes(S3_MAX_MEMORY_BYTES)
            .minimumPartSizeInBytes(S3_MINIMUM_PART_SIZE_BYTES);
        if (region != null) {
            clientBuilder.region(Region.of(region));
        }
        if (endpoint != null) {
            clientBuilder.endpointOverride(endpoint).forcePathStyle(true);
        }
        return clientBuilder.build();
    }

    @Override
    public List<PutResult> put(Path root, List<String> files, String target, String contentType) {
        var location = S3Uri.parse(target);
        List<PutResult> results = new ArrayList<>();
        for (int start = 0; start < files.size(); start += MAX_CONCURRENT_UPLOADS) {
            var window = files.subList(start, Math.min(files.size(), start + MAX_CONCURRENT_UPLOADS));
            List<CompletableFuture<PutResult>> uploads = new ArrayList<>();
            for (String file : window) {
                uploads.add(upload(root, file, location, contentType));
            }
            for (CompletableFuture<PutResult> upload : uploads) {
                results.add(upload.join());
            }
        }
        return results;
    }

    private CompletableFuture<PutResult> upload(Path root, String file, S3Uri location, String contentType) {
        Path source = root.resolve(file);
        if (!Files.isRegularFile(source)) {
            return CompletableFuture.completedFuture(PutResult.failed(file, FILE_NOT_FOUND));
        }
        var key = location.keyFor(file);
        var request = PutObjectRequest.builder()
            .bucket(location.bucketName())
            .key(key)
            .contentType(contentType)
            .build();
        CompletableFuture<PutResult> upload;
        try {
            upload = s3Client.putObject(request, AsyncRequestBody.fromFile(source))
                .thenApply(response -> {
                    log.debug("Uploaded {} to s3://{}/{}", source, location.bucketName(), key);
                    return PutResult.stored(file);
                });
        } catch (RuntimeException e) {
            upload = CompletableFuture.failedFuture(e);
        }
        return upload.exceptionally(e -> {
            var message = "Failed to upload " + source + ": " + unwrap(e).getMessage();
            log.error(message);
            return PutResult.failed(file, message);
        });
    }

    @Override
    public List<PutResult> empty(String target) {
        var location = S3Uri.parse(target);
        var listing = ListObjectsV2Request.builder()
            .bucket(location.bucketName())
            .prefix(location.listingPrefix());
        List<PutResult> results = new ArrayList<>();
        ListObjectsV2Response response;
        do {
            try {
                response = s3Client.listObjectsV2(listing.build()).join();
            } catch (CompletionException e) {
                var message = "Failed to list " + location + ": " + unwrap(e).getMessage();
                log.error(message);
                results.add(PutResult.failed(target, message));
                break;
            }
            var keys = response.contents().stream().map(S3Object::key).collect(Collectors.toList());
            for (int start = 0; start < keys.size(); start += MAX_KEYS_PER_DELETE) {
                results.addAll(deleteBatch(location,
                    keys.subList(start, Math.min(keys.size(), start + MAX_KEYS_PER_DELETE))));
            }
            listing.continuationToken(response.nextContinuationToken());
        } while (Boolean.TRUE.equals(response.isTruncated()));
        log.info("Removed {} of {} objects from {}", results.stream().filter(PutResult::success).count(),
            results.size(), location);
        return results;
    }

    /** One result per key; keys S3 reports no error for count as removed. */
    private List<PutResult> deleteBatch(S3Uri location, List<String> keys) {
        var identifiers = keys.stream()
            .map(key -> ObjectIdentifier.builder().key(key).build())
            .collect(Collectors.toList());
        DeleteObjectsResponse response;
        try {
            response = s3Client.deleteObjects(DeleteObjectsRequest.builder()
                .bucket(location.bucketName())
                .delete(Delete.builder().objects(identifiers).quiet(true).build())
                .build()).join();
        } catch (CompletionException e) {
            var message = "Failed to delete from s3://" + location.bucketName() + ": " + unwrap(e).getMessage();
            log.error("{} ({} keys starting at {})", message, keys.size(), keys.get(0));
            return keys.stream().map(key -> PutResult.failed(key, message)).collect(Collectors.toList());
        }
        Map<String, S3Error> errors = new HashMap<>();
        if (response.hasErrors()) {
            response.errors().forEach(error -> errors.put(error.key(), error));
        }
        List<PutResult> results = new ArrayList<>();
        for (String key : keys) {
            var error = errors.get(key);
            if (error == null) {
                results.add(PutResult.removed(key));
            } else {
                var message = "Failed to delete s3://" + location.bucketName() + "/" + key + ": "
                    + error.code() + " " + error.message();
                log.error(message);
                results.add(PutResult.failed(key, message));
            }
        }
        return results;
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }

    @Override
    public void close() {
        s3Client.close();
    }
}
