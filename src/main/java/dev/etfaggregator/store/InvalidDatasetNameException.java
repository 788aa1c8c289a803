package dev.etfaggregator.store;

import lombok.Getter;

/**
 * Thrown when a collection or kind name fails validation. Always propagated to the caller.
 */
@Getter
public class InvalidDatasetNameException extends IllegalArgumentException {

    private final String name;

    public InvalidDatasetNameException(String name, String reason) {
        super("Invalid dataset name '" + name + "': " + reason);
        this.name = name;
    }
}
