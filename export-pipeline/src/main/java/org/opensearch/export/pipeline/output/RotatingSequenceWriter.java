package org.opensearch.export.pipeline.output;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes newline-delimited records into a numbered series of gzip files
 * ({@code part_0000.jsonl.gz}, {@code part_0001.jsonl.gz}, ...) in one directory.
 *
 * <p>The first file is created up front, so an empty series is a single empty
 * {@code part_0000.jsonl.gz}. After {@link #rotate()} the next file is only created by the next
 * {@link #write}, so a series never ends with an empty file after a rotation and rotating twice
 * without writing in between leaves no gap in the numbering.</p>
 */
@Slf4j
public class RotatingSequenceWriter implements Closeable {
    private final Path directory;
    private final List<Path> files = new ArrayList<>();
    private Writer current;
    @Getter
    private int fileIndex;
    @Getter
    private long linesInCurrentFile;

    public RotatingSequenceWriter(Path directory) throws IOException {
        this.directory = directory;
        open();
    }

    public static String fileName(int index) {
        return String.format("part_%04d.jsonl.gz", index);
    }

    public void write(String line) throws IOException {
        if (current == null) {
            open();
        }
        current.write(line);
        current.write('\n');
        linesInCurrentFile++;
    }

    /**
     * Closes the current file; the next write goes to the next file in the series. Does nothing
     * when no file is open.
     */
    public void rotate() throws IOException {
        if (current == null) {
            return;
        }
        current.close();
        current = null;
        log.atDebug().setMessage("Closed {} with {} lines")
            .addArgument(() -> files.get(fileIndex).getFileName())
            .addArgument(linesInCurrentFile)
            .log();
        fileIndex++;
        linesInCurrentFile = 0;
    }

    /** Every file created so far, in order. */
    public List<Path> getFiles() {
        return Collections.unmodifiableList(files);
    }

    @Override
    public void close() throws IOException {
        if (current != null) {
            current.close();
            current = null;
        }
    }

    private void open() throws IOException {
        var path = directory.resolve(fileName(fileIndex));
        current = gzipWriter(path);
        files.add(path);
        linesInCurrentFile = 0;
    }

    static Writer gzipWriter(Path path) throws IOException {
        return new BufferedWriter(new OutputStreamWriter(
            new GZIPOutputStream(Files.newOutputStream(path)), StandardCharsets.UTF_8));
    }
}
