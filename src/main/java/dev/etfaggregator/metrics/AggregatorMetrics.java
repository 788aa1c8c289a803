package dev.etfaggregator.metrics;

import dev.etfaggregator.model.RunOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for ETF update runs.
 */
@Component
public class AggregatorMetrics {

    private static final String TAG_SOURCE = "source";
    private static final String TAG_OUTCOME = "outcome";
    private final MeterRegistry registry;

    private final Counter recordsSavedCounter;
    private final Counter segmentsWrittenCounter;

    private final ConcurrentHashMap<String, Timer> sourceTimers = new ConcurrentHashMap<>();

    private final AtomicInteger lastRunSucceeded = new AtomicInteger(0);
    private final AtomicInteger lastRunSkipped = new AtomicInteger(0);
    private final AtomicInteger lastRunFailed = new AtomicInteger(0);
    private final AtomicInteger lastRunRecords = new AtomicInteger(0);

    public AggregatorMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.recordsSavedCounter = Counter.builder("etf_aggregator_records_saved_total")
                .description("Total ETF records persisted to the data lake")
                .register(registry);

        this.segmentsWrittenCounter = Counter.builder("etf_aggregator_segments_written_total")
                .description("Total segment files written")
                .register(registry);

        Gauge.builder("etf_aggregator_last_run_succeeded", lastRunSucceeded, AtomicInteger::get)
                .description("Sources updated in last run")
                .register(registry);

        Gauge.builder("etf_aggregator_last_run_skipped", lastRunSkipped, AtomicInteger::get)
                .description("Sources skipped as fresh in last run")
                .register(registry);

        Gauge.builder("etf_aggregator_last_run_failed", lastRunFailed, AtomicInteger::get)
                .description("Sources failed in last run")
                .register(registry);

        Gauge.builder("etf_aggregator_last_run_records", lastRunRecords, AtomicInteger::get)
                .description("Records saved in last run")
                .register(registry);
    }

    /**
     * Get or create a timer for a specific source.
     */
    public Timer getSourceTimer(String sourceName) {
        return sourceTimers.computeIfAbsent(sourceName, name ->
                Timer.builder("etf_aggregator_source_fetch_duration")
                        .description("Time to fetch the raw payload from a source")
                        .tag(TAG_SOURCE, name)
                        .register(registry)
        );
    }

    /**
     * Count one finished source run by outcome.
     */
    public void recordRunOutcome(RunOutcome outcome) {
        Counter.builder("etf_aggregator_runs_total")
                .tag(TAG_OUTCOME, outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordRecordsSaved(int count) {
        recordsSavedCounter.increment(count);
    }

    public void recordSegmentsWritten(int count) {
        segmentsWrittenCounter.increment(count);
    }

    /**
     * Increment fetch failures counter for a source.
     */
    public void incrementFetchFailures(String source) {
        Counter.builder("etf_aggregator_fetch_failures_by_source_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    /**
     * Count upstream items a source dropped while parsing.
     */
    public void recordParseDropped(String source, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("etf_aggregator_parse_dropped_by_source_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment(count);
    }

    /**
     * Record fetch latency for a source.
     */
    public void recordFetchLatency(String source, long latencyMs) {
        getSourceTimer(source).record(Duration.ofMillis(latencyMs));
    }

    /**
     * Update last run statistics.
     */
    public void updateLastRunStats(int succeeded, int skipped, int failed, int records) {
        lastRunSucceeded.set(succeeded);
        lastRunSkipped.set(skipped);
        lastRunFailed.set(failed);
        lastRunRecords.set(records);
    }
}
