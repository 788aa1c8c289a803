package dev.etfaggregator.source;

/**
 * A single upstream item could not be turned into a record. Callers drop the item.
 */
public class SourceParseException extends RuntimeException {

    public SourceParseException(String message) {
        super(message);
    }

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
