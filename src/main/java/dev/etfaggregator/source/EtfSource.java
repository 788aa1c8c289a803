package dev.etfaggregator.source;

import dev.etfaggregator.model.EtfRecord;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Contract every upstream ETF provider implements.
 * <p>
 * {@link #fetch()} performs the network I/O and must carry its own timeout;
 * {@link #parse(Object)} is a pure transformation that drops malformed items instead of failing.
 * The orchestrator only ever calls {@link #run()}.
 *
 * @param <R> raw payload type (HTML text, JSON text, ...)
 */
public interface EtfSource<R> {

    /**
     * Stable provider name (e.g. "iShares"); used as the dataset collection.
     */
    String identity();

    /**
     * Retrieve the raw upstream representation.
     * Fails with {@link SourceFetchException} on timeouts, non-2xx answers or connection errors.
     */
    Mono<R> fetch();

    /**
     * Turn a raw payload into records. Never performs I/O.
     */
    List<EtfRecord> parse(R raw);

    /**
     * Fetch then parse. Each call yields a fresh, complete list; parsing runs off the I/O threads.
     */
    default Mono<List<EtfRecord>> run() {
        return fetch()
                .publishOn(Schedulers.parallel())
                .map(this::parse)
                .defaultIfEmpty(List.of());
    }

    /**
     * Check if this source is enabled.
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Build a source from a fetch function and a parse function.
     */
    static <R> EtfSource<R> of(String identity, Supplier<Mono<R>> fetcher, Function<R, List<EtfRecord>> parser) {
        return new ComposedEtfSource<>(identity, fetcher, parser);
    }
}
