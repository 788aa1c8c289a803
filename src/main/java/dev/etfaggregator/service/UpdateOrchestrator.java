package dev.etfaggregator.service;

import dev.etfaggregator.config.AggregatorProperties;
import dev.etfaggregator.metrics.AggregatorMetrics;
import dev.etfaggregator.model.EtfRecord;
import dev.etfaggregator.model.RunResult;
import dev.etfaggregator.model.UpdateSummary;
import dev.etfaggregator.source.EtfSource;
import dev.etfaggregator.store.ChunkedStore;
import dev.etfaggregator.store.DatasetManifest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs sources, applies the freshness gate and persists what they return.
 * <p>
 * Each source is isolated: whatever it does, it ends as a {@link RunResult} and never
 * affects the other sources of the same pass.
 */
@Slf4j
@Service
public class UpdateOrchestrator {

    public static final String LISTING = "listing";
    private static final String SEPARATOR = "========================================";

    private final List<EtfSource<?>> sources;
    private final ChunkedStore store;
    private final FreshnessPolicy freshnessPolicy;
    private final RunHistoryService runHistory;
    private final AggregatorMetrics metrics;
    private final AggregatorProperties properties;
    private final Clock clock;

    public UpdateOrchestrator(List<EtfSource<?>> sources,
                              ChunkedStore store,
                              FreshnessPolicy freshnessPolicy,
                              RunHistoryService runHistory,
                              AggregatorMetrics metrics,
                              AggregatorProperties properties,
                              Clock clock) {
        this.sources = sources.stream()
                .filter(EtfSource::isEnabled)
                .toList();
        this.store = store;
        this.freshnessPolicy = freshnessPolicy;
        this.runHistory = runHistory;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        log.info("Registered {} ETF sources: {}", this.sources.size(),
                this.sources.stream().map(EtfSource::identity).toList());
    }

    public List<EtfSource<?>> getSources() {
        return sources;
    }

    /**
     * Find an enabled source by name, ignoring case.
     */
    public Optional<EtfSource<?>> findSource(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        return sources.stream()
                .filter(source -> source.identity().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    /**
     * Update one source and record the result in the run history.
     * The returned Mono never errors.
     */
    public Mono<RunResult> updateOne(EtfSource<?> source, boolean force) {
        return execute(source, force)
                .flatMap(result -> recordHistory(List.of(result)).thenReturn(result));
    }

    /**
     * Update every enabled source concurrently.
     */
    public Mono<UpdateSummary> updateAll(boolean force) {
        return Flux.fromIterable(sources)
                .flatMap(source -> execute(source, force))
                .collectList()
                .map(results -> UpdateSummary.of(results, clock.instant()))
                .doOnSubscribe(s -> {
                    log.info(SEPARATOR);
                    log.info("ETF update starting: {} sources (force={})", sources.size(), force);
                    log.info(SEPARATOR);
                })
                .doOnNext(this::logSummary)
                .flatMap(summary -> recordHistory(summary.results()).thenReturn(summary));
    }

    /**
     * Stored listing of one collection; empty when it was never written.
     */
    public Mono<List<EtfRecord>> getCollection(String collection) {
        return Mono.fromCallable(() -> store.load(collection, LISTING, EtfRecord.class))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Stored listings of every enabled source, in registration order.
     * A collection that cannot be read is reported as empty.
     */
    public Mono<Map<String, List<EtfRecord>>> getAll() {
        return Flux.fromIterable(sources)
                .concatMap(source -> getCollection(source.identity())
                        .onErrorResume(e -> {
                            log.warn("[{}] Cannot read stored listing: {}", source.identity(), e.getMessage());
                            return Mono.just(List.of());
                        })
                        .map(records -> Map.entry(source.identity(), records)))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue, LinkedHashMap::new);
    }

    private Mono<RunResult> execute(EtfSource<?> source, boolean force) {
        String collection = source.identity();
        Duration window = properties.getFreshnessWindow();

        return Mono.fromCallable(() -> !force && freshnessPolicy.isFresh(collection, LISTING, window))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(fresh -> {
                    if (fresh) {
                        return Mono.just(RunResult.skipped(collection,
                                "updated within the last " + window, clock.instant()));
                    }
                    return runAndSave(source);
                })
                .onErrorResume(e -> Mono.just(RunResult.failed(collection, e, clock.instant())))
                .doOnNext(this::logResult);
    }

    private Mono<RunResult> runAndSave(EtfSource<?> source) {
        String collection = source.identity();
        long start = System.currentTimeMillis();

        return Mono.defer(source::run)
                .timeout(properties.getSourceTimeout())
                .defaultIfEmpty(List.of())
                .flatMap(fetched -> {
                    List<EtfRecord> records = fetched.stream()
                            .filter(UpdateOrchestrator::hasTicker)
                            .toList();
                    int dropped = fetched.size() - records.size();
                    if (dropped > 0) {
                        log.warn("[{}] Dropped {} records without a ticker", collection, dropped);
                        metrics.recordParseDropped(collection, dropped);
                    }
                    log.info("[{}] Fetched {} records in {}ms", collection, records.size(),
                            System.currentTimeMillis() - start);
                    if (records.isEmpty()) {
                        return Mono.just(RunResult.noData(collection, clock.instant()));
                    }
                    return Mono.fromCallable(() -> store.save(collection, LISTING, records,
                                    properties.getStorage().getFormat()))
                            .subscribeOn(Schedulers.boundedElastic())
                            .map(manifest -> saved(collection, records.size(), manifest));
                });
    }

    private static boolean hasTicker(EtfRecord record) {
        return record != null && record.getTicker() != null && !record.getTicker().isBlank();
    }

    private RunResult saved(String collection, int count, DatasetManifest manifest) {
        metrics.recordRecordsSaved(count);
        metrics.recordSegmentsWritten(manifest.segmentCount());
        return RunResult.succeeded(collection, count, manifest, clock.instant());
    }

    private Mono<Integer> recordHistory(List<RunResult> results) {
        return Mono.fromCallable(() -> runHistory.record(results))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("Run history unavailable: {}", e.getMessage());
                    return Mono.just(0);
                });
    }

    private void logResult(RunResult result) {
        metrics.recordRunOutcome(result.outcome());
        switch (result.outcome()) {
            case SUCCEEDED -> log.info("[{}] Saved {} records ({} segments)", result.collection(),
                    result.count(), result.manifest().segmentCount());
            case SKIPPED -> log.info("[{}] Skipped: {}", result.collection(), result.reason());
            case FAILED -> log.warn("[{}] Failed: {}{}", result.collection(), result.error(),
                    result.errorType() != null ? " (" + result.errorType() + ")" : "");
        }
    }

    private void logSummary(UpdateSummary summary) {
        metrics.updateLastRunStats(summary.succeeded(), summary.skipped(), summary.failed(), summary.totalRecords());
        log.info(SEPARATOR);
        log.info("UPDATE SUMMARY: {} succeeded, {} skipped, {} failed, {} records saved",
                summary.succeeded(), summary.skipped(), summary.failed(), summary.totalRecords());
        log.info(SEPARATOR);
    }
}
