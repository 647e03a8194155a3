package org.opensearch.export.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Destination for a finished export: a location that can be emptied and then filled with files.
 */
public interface BulkStorage extends AutoCloseable {
    String FILE_NOT_FOUND = "File not found";

    /**
     * Stores each file under {@code target}, keeping its path relative to {@code root}.
     * Files are handled independently: a missing file or a failed upload yields a failed result and
     * the remaining files are still attempted.
     *
     * @param root the directory the file names are relative to
     * @param files file names relative to {@code root}, using {@code /} as separator
     * @param target where to store the files, in the form the implementation understands
     * @param contentType media type recorded with each stored file, if the storage keeps one
     * @return one result per requested file, in request order
     */
    List<PutResult> put(Path root, List<String> files, String target, String contentType);

    /**
     * Removes everything currently stored under {@code target}. Like {@link #put}, this is best
     * effort per file: an object that cannot be removed yields a failed result and the rest are
     * still attempted.
     *
     * @return one result per object found under {@code target}, plus a failed result named after
     *         the target when part of it could not be listed
     * @throws IOException if {@code target} is not a location this storage can empty
     */
    List<PutResult> empty(String target) throws IOException;

    @Override
    default void close() {
    }
}
