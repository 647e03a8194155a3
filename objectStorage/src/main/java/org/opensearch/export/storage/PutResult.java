package org.opensearch.export.storage;

/**
 * Outcome of storing or removing one file.
 *
 * @param file the file as it was named in the request, relative to the upload root
 * @param success whether the file was stored
 * @param message what happened, suitable for logging
 */
public record PutResult(String file, boolean success, String message) {

    public static PutResult stored(String file) {
        return new PutResult(file, true, "Successfully uploaded");
    }

    public static PutResult removed(String file) {
        return new PutResult(file, true, "Removed");
    }

    public static PutResult failed(String file, String message) {
        return new PutResult(file, false, message);
    }
}
