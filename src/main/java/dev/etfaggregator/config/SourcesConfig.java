package dev.etfaggregator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.stream.Stream;

/**
 * Per-provider endpoint settings.
 * Loaded from application.yml under 'sources' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sources")
public class SourcesConfig {

    private Endpoint ishares = new Endpoint();
    private Endpoint goldmanSachs = new Endpoint();
    private Endpoint alphaArchitect = new Endpoint();

    /**
     * Number of providers switched on.
     */
    public long getEnabledCount() {
        return Stream.of(ishares, goldmanSachs, alphaArchitect)
                .filter(Endpoint::isEnabled)
                .count();
    }

    @Data
    public static class Endpoint {
        private boolean enabled = true;

        /**
         * Overrides the provider's built-in URL when set.
         */
        private String url;

        private Duration timeout = Duration.ofSeconds(30);
        private int retries = 2;
        private Duration retryBackoff = Duration.ofSeconds(1);
    }
}
