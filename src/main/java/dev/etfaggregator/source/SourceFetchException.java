package dev.etfaggregator.source;

import lombok.Getter;

/**
 * Network or upstream failure while fetching a source's raw payload.
 */
@Getter
public class SourceFetchException extends RuntimeException {

    private final String source;

    public SourceFetchException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }
}
