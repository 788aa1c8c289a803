package dev.etfaggregator.config;

import dev.etfaggregator.store.SerializationFormat;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Runtime settings for the aggregator.
 * Loaded from application.yml under 'aggregator' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "aggregator")
public class AggregatorProperties {

    /**
     * A dataset younger than this is not refetched unless forced.
     */
    private Duration freshnessWindow = Duration.ofHours(24);

    /**
     * Backstop applied around a whole source run (fetch and parse).
     */
    private Duration sourceTimeout = Duration.ofMinutes(2);

    /**
     * Run one update of every source, then exit.
     */
    private boolean runOnce = false;

    /**
     * Ignore freshness in run-once mode.
     */
    private boolean force = false;

    private Storage storage = new Storage();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Storage {
        private String root = "./data";
        private long maxSegmentBytes = 4L * 1024 * 1024;
        private SerializationFormat format = SerializationFormat.JSON;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private int hour = 18;
        private int minute = 0;
        private String zone = "America/New_York";
    }
}
