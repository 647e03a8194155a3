package org.opensearch.export.storage.s3;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Error;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * In-memory stand-in for the S3 operations the bulk storage uses. Objects are kept as
 * {@code bucket/key} to content type; uploads of keys containing {@code fail} are rejected, and so
 * are deletes of keys in {@link #undeletableKeys}.
 */
class FakeS3AsyncClient implements S3AsyncClient {
    final Map<String, String> objects = new TreeMap<>();
    final List<DeleteObjectsRequest> deleteRequests = new ArrayList<>();
    final Set<String> undeletableKeys = new HashSet<>();
    int pageSize = 1000;
    boolean closed;

    @Override
    public synchronized CompletableFuture<PutObjectResponse> putObject(PutObjectRequest request,
                                                                      AsyncRequestBody body) {
        if (request.key().contains("fail")) {
            return CompletableFuture.failedFuture(S3Exception.builder().message("Access Denied").statusCode(403).build());
        }
        objects.put(request.bucket() + "/" + request.key(), request.contentType());
        return CompletableFuture.completedFuture(PutObjectResponse.builder().eTag("etag").build());
    }

    @Override
    public synchronized CompletableFuture<ListObjectsV2Response> listObjectsV2(ListObjectsV2Request request) {
        var bucketPrefix = request.bucket() + "/";
        var matching = objects.keySet().stream()
            .filter(k -> k.startsWith(bucketPrefix + request.prefix()))
            .map(k -> k.substring(bucketPrefix.length()))
            .collect(Collectors.toList());
        // The token is the last key already returned
        var after = request.continuationToken();
        var remaining = matching.stream()
            .filter(key -> after == null || key.compareTo(after) > 0)
            .collect(Collectors.toList());
        var page = remaining.stream().limit(pageSize).collect(Collectors.toList());
        boolean truncated = remaining.size() > page.size();
        return CompletableFuture.completedFuture(ListObjectsV2Response.builder()
            .contents(page.stream().map(key -> S3Object.builder().key(key).build()).collect(Collectors.toList()))
            .isTruncated(truncated)
            .nextContinuationToken(truncated ? page.get(page.size() - 1) : null)
            .build());
    }

    @Override
    public synchronized CompletableFuture<DeleteObjectsResponse> deleteObjects(DeleteObjectsRequest request) {
        deleteRequests.add(request);
        List<S3Error> errors = new ArrayList<>();
        for (ObjectIdentifier identifier : request.delete().objects()) {
            if (undeletableKeys.contains(identifier.key())) {
                errors.add(S3Error.builder().key(identifier.key()).code("AccessDenied").message("Access Denied").build());
            } else {
                objects.remove(request.bucket() + "/" + identifier.key());
            }
        }
        return CompletableFuture.completedFuture(DeleteObjectsResponse.builder().errors(errors).build());
    }

    @Override
    public String serviceName() {
        return "s3";
    }

    @Override
    public void close() {
        closed = true;
    }
}
