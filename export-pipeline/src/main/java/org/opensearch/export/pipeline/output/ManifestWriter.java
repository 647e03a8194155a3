package org.opensearch.export.pipeline.output;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.extern.slf4j.Slf4j;

/**
 * Lists every {@code dois/<dir>/<file>.gz} under an output root, with its size in bytes, into a
 * {@code MANIFEST} file at the root. Paths are relative to the root, use {@code /} and are sorted.
 */
@Slf4j
public class ManifestWriter {
    public static final String MANIFEST_FILE_NAME = "MANIFEST";
    public static final String DATA_DIRECTORY = "dois";

    public record Entry(String path, long size) {
        String line() {
            return path + " " + size;
        }
    }

    private final Path outputRoot;

    public ManifestWriter(Path outputRoot) {
        this.outputRoot = outputRoot;
    }

    public Path getManifestPath() {
        return outputRoot.resolve(MANIFEST_FILE_NAME);
    }

    /** Finds the data files without writing anything. */
    public List<Entry> collectEntries() throws IOException {
        var dataDirectory = outputRoot.resolve(DATA_DIRECTORY);
        if (!Files.isDirectory(dataDirectory)) {
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(dataDirectory, 2)) {
            files = walk
                .filter(p -> dataDirectory.relativize(p).getNameCount() == 2)
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".gz"))
                .collect(Collectors.toList());
        }
        List<Entry> entries = new ArrayList<>();
        for (Path file : files) {
            var relative = outputRoot.relativize(file).toString().replace('\\', '/');
            entries.add(new Entry(relative, Files.size(file)));
        }
        entries.sort(Comparator.comparing(Entry::path));
        return entries;
    }

    /** Writes the manifest and returns its entries. */
    public List<Entry> write() throws IOException {
        var entries = collectEntries();
        var lines = entries.stream().map(Entry::line).collect(Collectors.toList());
        Files.write(getManifestPath(), lines, StandardCharsets.UTF_8);
        log.info("Wrote {} with {} entries", getManifestPath(), entries.size());
        return entries;
    }
}
