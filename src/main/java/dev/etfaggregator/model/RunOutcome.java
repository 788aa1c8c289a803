package dev.etfaggregator.model;

/**
 * How a single source update ended.
 */
public enum RunOutcome {
    SUCCEEDED,
    SKIPPED,
    FAILED
}
