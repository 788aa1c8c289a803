package dev.etfaggregator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.etfaggregator.store.DatasetManifest;

import java.time.Instant;

/**
 * Outcome of updating one source.
 *
 * @param collection dataset the source writes to
 * @param outcome    succeeded, skipped (fresh) or failed
 * @param count      records persisted, zero unless succeeded
 * @param manifest   manifest of the written dataset, only when succeeded
 * @param error      human readable failure message
 * @param errorType  simple class name of the failure cause
 * @param reason     why the source was skipped
 * @param finishedAt completion time
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResult(
        String collection,
        RunOutcome outcome,
        int count,
        DatasetManifest manifest,
        String error,
        String errorType,
        String reason,
        Instant finishedAt) {

    public static final String NO_DATA = "no data";

    public static RunResult succeeded(String collection, int count, DatasetManifest manifest, Instant finishedAt) {
        return new RunResult(collection, RunOutcome.SUCCEEDED, count, manifest, null, null, null, finishedAt);
    }

    public static RunResult skipped(String collection, String reason, Instant finishedAt) {
        return new RunResult(collection, RunOutcome.SKIPPED, 0, null, null, null, reason, finishedAt);
    }

    public static RunResult noData(String collection, Instant finishedAt) {
        return new RunResult(collection, RunOutcome.FAILED, 0, null, NO_DATA, null, null, finishedAt);
    }

    public static RunResult failed(String collection, Throwable cause, Instant finishedAt) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new RunResult(collection, RunOutcome.FAILED, 0, null, message,
                cause.getClass().getSimpleName(), null, finishedAt);
    }

    @JsonIgnore
    public boolean isSucceeded() {
        return outcome == RunOutcome.SUCCEEDED;
    }

    @JsonIgnore
    public boolean isSkipped() {
        return outcome == RunOutcome.SKIPPED;
    }

    @JsonIgnore
    public boolean isFailed() {
        return outcome == RunOutcome.FAILED;
    }
}
