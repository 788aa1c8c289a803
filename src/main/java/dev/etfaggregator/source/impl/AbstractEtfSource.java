package dev.etfaggregator.source.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.etfaggregator.config.SourcesConfig;
import dev.etfaggregator.metrics.AggregatorMetrics;
import dev.etfaggregator.model.EtfRecord;
import dev.etfaggregator.source.EtfSource;
import dev.etfaggregator.source.SourceFetchException;
import dev.etfaggregator.source.SourceParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Shared HTTP plumbing for sources that fetch a text payload over the network.
 */
@Slf4j
public abstract class AbstractEtfSource implements EtfSource<String> {

    // Upstream decimals keep their scale: 512.30 stays 512.30
    protected static final ObjectMapper JSON = JsonMapper.builder()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
            .build();

    protected final WebClient webClient;
    protected final AggregatorMetrics metrics;
    protected final SourcesConfig.Endpoint endpoint;

    protected AbstractEtfSource(WebClient.Builder webClientBuilder, AggregatorMetrics metrics,
                                SourcesConfig.Endpoint endpoint) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .responseTimeout(endpoint.getTimeout())
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent",
                        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36")
                .defaultHeader("Accept", "application/json, text/html, text/plain, */*")
                .defaultHeader("Accept-Language", "en-US,en;q=0.9")
                .build();
        this.metrics = metrics;
        this.endpoint = endpoint;
    }

    /**
     * Built-in upstream URL, used unless the endpoint configures one.
     */
    protected abstract String defaultUrl();

    @Override
    public boolean isEnabled() {
        return endpoint.isEnabled();
    }

    protected String getUrl() {
        String configured = endpoint.getUrl();
        return configured != null && !configured.isBlank() ? configured : defaultUrl();
    }

    /**
     * Execute a timed GET request.
     */
    protected Mono<String> timedGet(String url) {
        return timed(webClient.get()
                .uri(url)
                .retrieve()
                .bodyToMono(String.class));
    }

    /**
     * Execute a timed POST request with a JSON body.
     */
    protected Mono<String> timedPost(String url, Object body) {
        return timed(webClient.post()
                .uri(url)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class));
    }

    private Mono<String> timed(Mono<String> request) {
        Duration timeout = endpoint.getTimeout();
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            return request
                    .timeout(timeout)
                    .retryWhen(Retry.backoff(endpoint.getRetries(), endpoint.getRetryBackoff())
                            .filter(AbstractEtfSource::isRetryable)
                            .doBeforeRetry(signal -> log.debug("{} - retrying after {}",
                                    identity(), signal.failure().getMessage()))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .doOnTerminate(() -> metrics.recordFetchLatency(identity(),
                            System.currentTimeMillis() - start));
        })
                .doOnError(e -> {
                    log.warn("{} - fetch failed: {}", identity(), describe(e, timeout));
                    metrics.incrementFetchFailures(identity());
                })
                .onErrorMap(e -> !(e instanceof SourceFetchException),
                        e -> new SourceFetchException(identity(), describe(e, timeout), e));
    }

    static boolean isRetryable(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return false;
    }

    private static String describe(Throwable e, Duration timeout) {
        if (e instanceof TimeoutException) {
            return "timed out after " + timeout.toSeconds() + "s";
        }
        if (e instanceof WebClientResponseException response) {
            return "HTTP " + response.getStatusCode().value();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Read a JSON document. A payload that is not JSON yields a missing node.
     */
    protected JsonNode readJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return JSON.missingNode();
        }
        try {
            return JSON.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("{} - payload is not valid JSON: {}", identity(), e.getOriginalMessage());
            return JSON.missingNode();
        }
    }

    /**
     * Map upstream items to records, dropping the ones that fail.
     */
    protected <I> List<EtfRecord> mapItems(Collection<I> items, Function<I, EtfRecord> mapper) {
        List<EtfRecord> records = new ArrayList<>(items.size());
        int dropped = 0;
        for (I item : items) {
            try {
                EtfRecord etf = mapper.apply(item);
                if (etf != null) {
                    records.add(etf);
                }
            } catch (SourceParseException e) {
                dropped++;
                log.debug("{} - dropped item: {}", identity(), e.getMessage());
            } catch (RuntimeException e) {
                dropped++;
                log.debug("{} - dropped malformed item: {}", identity(), e.toString());
            }
        }
        if (dropped > 0) {
            log.info("{} - parsed {} records, dropped {} malformed items", identity(), records.size(), dropped);
            metrics.recordParseDropped(identity(), dropped);
        }
        return records;
    }
}
