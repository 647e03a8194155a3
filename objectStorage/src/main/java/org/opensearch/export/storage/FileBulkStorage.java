package org.opensearch.export.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.extern.slf4j.Slf4j;

/**
 * BulkStorage over a local directory, for runs that publish to a mounted volume instead of S3.
 * The target is a directory path.
 */
@Slf4j
public class FileBulkStorage implements BulkStorage {

    @Override
    public List<PutResult> put(Path root, List<String> files, String target, String contentType) {
        var targetDirectory = Paths.get(target);
        List<PutResult> results = new ArrayList<>();
        for (String file : files) {
            Path source = root.resolve(file);
            if (!Files.isRegularFile(source)) {
                results.add(PutResult.failed(file, FILE_NOT_FOUND));
                continue;
            }
            Path destination = targetDirectory.resolve(file);
            try {
                Files.createDirectories(destination.getParent());
                Files.copy(source, destination, StandardCopyOption.REPLACE_EXISTING);
                log.debug("Copied {} to {}", source, destination);
                results.add(PutResult.stored(file));
            } catch (IOException e) {
                var message = "Failed to copy " + source + ": " + e.getMessage();
                log.error(message);
                results.add(PutResult.failed(file, message));
            }
        }
        return results;
    }

    @Override
    public List<PutResult> empty(String target) throws IOException {
        var targetDirectory = Paths.get(target);
        if (!Files.exists(targetDirectory)) {
            Files.createDirectories(targetDirectory);
            return List.of();
        }
        if (!Files.isDirectory(targetDirectory)) {
            throw new IOException("Target is not a directory: " + targetDirectory);
        }
        List<Path> contents;
        try (Stream<Path> walk = Files.walk(targetDirectory)) {
            contents = walk.filter(p -> !p.equals(targetDirectory))
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());
        }
        List<PutResult> results = new ArrayList<>();
        for (Path path : contents) {
            var name = targetDirectory.relativize(path).toString().replace('\\', '/');
            try {
                Files.delete(path);
                results.add(PutResult.removed(name));
            } catch (IOException e) {
                var message = "Failed to delete " + path + ": " + e;
                log.error(message);
                results.add(PutResult.failed(name, message));
            }
        }
        log.info("Removed {} of {} entries from {}", results.stream().filter(PutResult::success).count(),
            contents.size(), targetDirectory);
        return results;
    }
}
