package org.opensearch.export.storage.s3;

import java.net.URI;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Utilities;

/**
 * An {@code s3://bucket/prefix} location. The prefix has no leading or trailing slash and is empty
 * for the root of the bucket.
 */
public record S3Uri(String bucketName, String prefix) {

    public S3Uri {
        if (bucketName == null || bucketName.isBlank()) {
            throw new IllegalArgumentException("Bucket name cannot be null or empty");
        }
        prefix = trimSlashes(prefix == null ? "" : prefix);
    }

    public static S3Uri parse(String rawUri) {
        if (rawUri == null || !rawUri.startsWith("s3://")) {
            throw new IllegalArgumentException("URI must start with s3://: " + rawUri);
        }
        try {
            var parsed = S3Utilities.builder()
                .region(Region.US_EAST_1)
                .build()
                .parseUri(URI.create(rawUri));
            var bucket = parsed.bucket()
                .orElseThrow(() -> new IllegalArgumentException("No bucket found in S3 URI: " + rawUri));
            return new S3Uri(bucket, parsed.key().orElse(""));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid S3 URI: " + rawUri, e);
        }
    }

    /** The object key for a path relative to this location. */
    public String keyFor(String relativePath) {
        var path = trimSlashes(relativePath);
        return prefix.isEmpty() ? path : prefix + "/" + path;
    }

    /** The listing prefix matching every object under this location. */
    public String listingPrefix() {
        return prefix.isEmpty() ? "" : prefix + "/";
    }

    @Override
    public String toString() {
        return "s3://" + bucketName + (prefix.isEmpty() ? "" : "/" + prefix);
    }

    private static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
