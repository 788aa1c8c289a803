package dev.etfaggregator.model;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate of one update pass over every enabled source.
 */
public record UpdateSummary(
        Instant timestamp,
        int totalSources,
        int succeeded,
        int skipped,
        int failed,
        int totalRecords,
        List<RunResult> results) {

    public static UpdateSummary of(List<RunResult> results, Instant timestamp) {
        int succeeded = 0;
        int skipped = 0;
        int failed = 0;
        int records = 0;
        for (RunResult result : results) {
            switch (result.outcome()) {
                case SUCCEEDED -> {
                    succeeded++;
                    records += result.count();
                }
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }
        return new UpdateSummary(timestamp, results.size(), succeeded, skipped, failed, records, List.copyOf(results));
    }
}
