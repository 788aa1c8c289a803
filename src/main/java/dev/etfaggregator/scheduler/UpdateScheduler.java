package dev.etfaggregator.scheduler;

import dev.etfaggregator.model.UpdateSummary;
import dev.etfaggregator.service.UpdateOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Fires a non-forced update of every source once a day at a wall-clock time in a given zone.
 * Start and stop are idempotent.
 */
@Slf4j
public class UpdateScheduler {

    private final UpdateOrchestrator orchestrator;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private ScheduledFuture<?> scheduledTask;
    private CronExpression cron;
    private ZoneId zone;
    private int hour;
    private int minute;

    public UpdateScheduler(UpdateOrchestrator orchestrator, TaskScheduler taskScheduler, Clock clock) {
        this.orchestrator = orchestrator;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * Schedule the daily update. Does nothing if already running.
     *
     * @throws IllegalArgumentException if hour or minute is out of range
     */
    public synchronized void start(int hour, int minute, ZoneId zone) {
        if (scheduledTask != null) {
            log.info("Update scheduler already running, next run at {}", nextRunTime().orElse(null));
            return;
        }
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new IllegalArgumentException("Invalid schedule time " + hour + ":" + minute);
        }
        String expression = String.format("0 %d %d * * *", minute, hour);
        this.cron = CronExpression.parse(expression);
        this.zone = zone;
        this.hour = hour;
        this.minute = minute;
        this.scheduledTask = taskScheduler.schedule(this::runScheduledUpdate, new CronTrigger(expression, zone));
        log.info("Update scheduler started: daily at {} {}, next run at {}",
                String.format("%02d:%02d", hour, minute), zone, nextRunTime().orElse(null));
    }

    /**
     * Cancel the daily update. Does nothing if not running.
     */
    public synchronized void stop() {
        if (scheduledTask == null) {
            log.debug("Update scheduler not running");
            return;
        }
        scheduledTask.cancel(false);
        scheduledTask = null;
        log.info("Update scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return scheduledTask != null;
    }

    /**
     * Next trigger time in the configured zone, empty while stopped.
     */
    public synchronized Optional<ZonedDateTime> nextRunTime() {
        if (scheduledTask == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cron.next(ZonedDateTime.now(clock).withZoneSameInstant(zone)));
    }

    public synchronized SchedulerStatus status() {
        if (scheduledTask == null) {
            return SchedulerStatus.stopped();
        }
        return new SchedulerStatus(true, nextRunTime().orElse(null), zone.getId(), hour, minute);
    }

    /**
     * Start a non-forced update right away without waiting for it.
     */
    public Disposable runNow() {
        log.info("Manual update requested");
        return orchestrator.updateAll(false)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        summary -> log.info("Manual update finished: {} succeeded, {} failed",
                                summary.succeeded(), summary.failed()),
                        e -> log.error("Manual update failed: {}", e.getMessage(), e));
    }

    void runScheduledUpdate() {
        log.info("Scheduled update triggered");
        try {
            UpdateSummary summary = orchestrator.updateAll(false).block();
            if (summary != null) {
                log.info("Scheduled update finished: {} succeeded, {} skipped, {} failed",
                        summary.succeeded(), summary.skipped(), summary.failed());
            }
        } catch (RuntimeException e) {
            log.error("Scheduled update failed: {}", e.getMessage(), e);
        }
    }
}
