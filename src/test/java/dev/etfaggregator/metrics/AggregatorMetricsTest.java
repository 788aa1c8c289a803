package dev.etfaggregator.metrics;

import dev.etfaggregator.model.RunOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AggregatorMetricsTest {

    private MeterRegistry meterRegistry;
    private AggregatorMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new AggregatorMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Run counters")
    class RunCounters {

        @Test
        @DisplayName("Should count runs by outcome")
        void shouldCountRunsByOutcome() {
            metrics.recordRunOutcome(RunOutcome.SUCCEEDED);
            metrics.recordRunOutcome(RunOutcome.SUCCEEDED);
            metrics.recordRunOutcome(RunOutcome.FAILED);

            assertThat(meterRegistry.counter("etf_aggregator_runs_total", "outcome", "succeeded").count())
                    .isEqualTo(2.0);
            assertThat(meterRegistry.counter("etf_aggregator_runs_total", "outcome", "failed").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should record saved records and written segments")
        void shouldRecordStorageCounters() {
            metrics.recordRecordsSaved(412);
            metrics.recordSegmentsWritten(2);

            assertThat(meterRegistry.counter("etf_aggregator_records_saved_total").count()).isEqualTo(412.0);
            assertThat(meterRegistry.counter("etf_aggregator_segments_written_total").count()).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("Source metrics")
    class SourceMetrics {

        @Test
        @DisplayName("Should count fetch failures per source")
        void shouldCountFetchFailures() {
            metrics.incrementFetchFailures("iShares");
            metrics.incrementFetchFailures("iShares");

            assertThat(meterRegistry.counter("etf_aggregator_fetch_failures_by_source_total", "source", "iShares")
                    .count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should count dropped items and ignore zero")
        void shouldCountParseDrops() {
            metrics.recordParseDropped("GoldmanSachs", 3);
            metrics.recordParseDropped("Alpha Architect", 0);

            assertThat(meterRegistry.counter("etf_aggregator_parse_dropped_by_source_total", "source", "GoldmanSachs")
                    .count()).isEqualTo(3.0);
            assertThat(meterRegistry.find("etf_aggregator_parse_dropped_by_source_total")
                    .tag("source", "Alpha Architect").counter()).isNull();
        }

        @Test
        @DisplayName("Should reuse one timer per source")
        void shouldRecordLatency() {
            metrics.recordFetchLatency("iShares", 150);
            metrics.recordFetchLatency("iShares", 50);

            Timer timer = metrics.getSourceTimer("iShares");
            assertThat(timer.count()).isEqualTo(2);
            assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
        }
    }

    @Test
    @DisplayName("Should expose last run statistics as gauges")
    void shouldUpdateLastRunGauges() {
        metrics.updateLastRunStats(2, 1, 1, 437);

        assertThat(meterRegistry.get("etf_aggregator_last_run_succeeded").gauge().value()).isEqualTo(2.0);
        assertThat(meterRegistry.get("etf_aggregator_last_run_skipped").gauge().value()).isEqualTo(1.0);
        assertThat(meterRegistry.get("etf_aggregator_last_run_failed").gauge().value()).isEqualTo(1.0);
        assertThat(meterRegistry.get("etf_aggregator_last_run_records").gauge().value()).isEqualTo(437.0);
    }
}
