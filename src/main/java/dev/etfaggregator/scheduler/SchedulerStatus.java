package dev.etfaggregator.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.ZonedDateTime;

/**
 * Snapshot of the daily update trigger.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SchedulerStatus(boolean running, ZonedDateTime nextRun, String zone, Integer hour, Integer minute) {

    public static SchedulerStatus stopped() {
        return new SchedulerStatus(false, null, null, null, null);
    }
}
