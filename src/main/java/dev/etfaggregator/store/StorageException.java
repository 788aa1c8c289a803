package dev.etfaggregator.store;

/**
 * Filesystem failure while reading or writing a dataset, or a dataset whose files on disk
 * disagree with its manifest.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
