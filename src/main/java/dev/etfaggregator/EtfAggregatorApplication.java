package dev.etfaggregator;

import dev.etfaggregator.config.AggregatorProperties;
import dev.etfaggregator.config.SourcesConfig;
import dev.etfaggregator.scheduler.UpdateScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.time.ZoneId;
import java.util.Arrays;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class EtfAggregatorApplication implements CommandLineRunner {

    static final String FORCE_FLAG = "--force";

    private final AggregatorProperties properties;
    private final SourcesConfig sourcesConfig;
    private final UpdateRunner updateRunner;
    private final UpdateScheduler updateScheduler;
    private final ShutdownManager shutdownManager;

    public static void main(String[] args) {
        SpringApplication.run(EtfAggregatorApplication.class, args);
    }

    @Override
    public void run(String... args) {
        long enabled = sourcesConfig.getEnabledCount();
        if (enabled == 0) {
            log.warn("No sources enabled; updates will report an empty summary");
        } else {
            log.info("Sources enabled: {}", enabled);
        }

        if (properties.isRunOnce()) {
            boolean force = properties.isForce() || Arrays.asList(args).contains(FORCE_FLAG);
            try {
                updateRunner.execute(force);
                shutdownManager.exit(0);
            } catch (Exception e) {
                log.error("ETF Aggregator failed: {}", e.getMessage(), e);
                shutdownManager.exit(1);
            }
            return;
        }

        AggregatorProperties.Scheduler schedule = properties.getScheduler();
        if (schedule.isEnabled()) {
            updateScheduler.start(schedule.getHour(), schedule.getMinute(), ZoneId.of(schedule.getZone()));
        } else {
            log.info("Daily update disabled (aggregator.scheduler.enabled=false)");
        }
    }
}
