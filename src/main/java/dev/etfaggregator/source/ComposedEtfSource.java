package dev.etfaggregator.source;

import dev.etfaggregator.model.EtfRecord;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link EtfSource} assembled from two functions, for sources that need no shared plumbing.
 */
record ComposedEtfSource<R>(String identity, Supplier<Mono<R>> fetcher, Function<R, List<EtfRecord>> parser)
        implements EtfSource<R> {

    ComposedEtfSource {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(fetcher, "fetcher");
        Objects.requireNonNull(parser, "parser");
    }

    @Override
    public Mono<R> fetch() {
        return Mono.defer(fetcher);
    }

    @Override
    public List<EtfRecord> parse(R raw) {
        return parser.apply(raw);
    }
}
