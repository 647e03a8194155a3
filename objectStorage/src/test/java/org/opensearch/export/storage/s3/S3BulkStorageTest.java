package org.opensearch.export.storage.s3;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.opensearch.export.storage.PutResult;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class S3BulkStorageTest {

    @TempDir
    Path root;

    private final FakeS3AsyncClient s3 = new FakeS3AsyncClient();
    private final S3BulkStorage storage = new S3BulkStorage(s3);

    @Test
    void eachFileGetsItsOwnResult() throws Exception {
        Files.createDirectories(root.resolve("dois/updated_2024-01"));
        Files.write(root.resolve("dois/updated_2024-01/part_0000.jsonl.gz"), new byte[] {1});
        Files.write(root.resolve("dois/updated_2024-01/fail.csv.gz"), new byte[] {1});

        var results = storage.put(root, List.of(
            "dois/updated_2024-01/part_0000.jsonl.gz",
            "dois/updated_2024-01/missing.jsonl.gz",
            "dois/updated_2024-01/fail.csv.gz"
        ), "s3://datafile/exports", "application/gzip");

        assertEquals(3, results.size());
        assertEquals(PutResult.stored("dois/updated_2024-01/part_0000.jsonl.gz"), results.get(0));
        assertEquals(PutResult.failed("dois/updated_2024-01/missing.jsonl.gz", "File not found"), results.get(1));
        assertFalse(results.get(2).success());
        assertTrue(results.get(2).message().contains("Access Denied"));
        assertEquals("application/gzip", s3.objects.get("datafile/exports/dois/updated_2024-01/part_0000.jsonl.gz"));
        assertEquals(1, s3.objects.size());
    }

    @Test
    void manyFilesAreUploadedInWindows() throws Exception {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < S3BulkStorage.MAX_CONCURRENT_UPLOADS * 2 + 5; i++) {
            var name = String.format("file-%03d.gz", i);
            Files.write(root.resolve(name), new byte[] {1});
            names.add(name);
        }

        var results = storage.put(root, names, "s3://datafile", "application/gzip");

        assertEquals(names, results.stream().map(PutResult::file).collect(Collectors.toList()));
        assertTrue(results.stream().allMatch(PutResult::success));
        assertTrue(s3.objects.containsKey("datafile/file-000.gz"));
    }

    @Test
    void emptyRemovesOnlyObjectsUnderThePrefixAcrossPages() throws Exception {
        s3.pageSize = 2;
        s3.objects.put("datafile/exports/a", "text/plain");
        s3.objects.put("datafile/exports/b", "text/plain");
        s3.objects.put("datafile/exports/c/d", "text/plain");
        s3.objects.put("datafile/exports-old/e", "text/plain");
        s3.objects.put("other/exports/f", "text/plain");

        var results = storage.empty("s3://datafile/exports");

        assertEquals(List.of("datafile/exports-old/e", "other/exports/f"), List.copyOf(s3.objects.keySet()));
        assertEquals(2, s3.deleteRequests.size());
        assertEquals(List.of("exports/a", "exports/b", "exports/c/d"),
            results.stream().map(PutResult::file).collect(Collectors.toList()));
        assertTrue(results.stream().allMatch(PutResult::success));
    }

    @Test
    void emptyCarriesOnPastAnObjectThatCannotBeDeleted() {
        s3.pageSize = 1;
        s3.undeletableKeys.add("exports/a");
        s3.objects.put("datafile/exports/a", "text/plain");
        s3.objects.put("datafile/exports/b", "text/plain");
        s3.objects.put("datafile/exports/c", "text/plain");

        var results = storage.empty("s3://datafile/exports");

        assertEquals(3, results.size());
        assertEquals("exports/a", results.get(0).file());
        assertFalse(results.get(0).success());
        assertTrue(results.get(0).message().contains("AccessDenied"));
        assertEquals(PutResult.removed("exports/b"), results.get(1));
        assertEquals(PutResult.removed("exports/c"), results.get(2));
        assertEquals(List.of("datafile/exports/a"), List.copyOf(s3.objects.keySet()));
    }

    @Test
    void closeReleasesClient() {
        storage.close();

        assertTrue(s3.closed);
    }
}
