package dev.etfaggregator.source;

import dev.etfaggregator.model.EtfRecord;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EtfSourceTest {

    private static List<EtfRecord> parseCsv(String raw) {
        return Arrays.stream(raw.split(","))
                .map(ticker -> EtfRecord.builder().ticker(ticker.trim()).build())
                .toList();
    }

    @Test
    void composedSourceFetchesThenParses() {
        EtfSource<String> source = EtfSource.of("Roundhill", () -> Mono.just("XDTE, QDTE"), EtfSourceTest::parseCsv);

        StepVerifier.create(source.run())
                .assertNext(records -> assertThat(records).extracting(EtfRecord::getTicker)
                        .containsExactly("XDTE", "QDTE"))
                .verifyComplete();
        assertThat(source.identity()).isEqualTo("Roundhill");
        assertThat(source.isEnabled()).isTrue();
    }

    @Test
    void composedSourceFetchesAgainOnEveryRun() {
        AtomicInteger calls = new AtomicInteger();
        EtfSource<String> source = EtfSource.of("Roundhill", () -> {
            calls.incrementAndGet();
            return Mono.just("XDTE");
        }, EtfSourceTest::parseCsv);

        Mono<List<EtfRecord>> run = source.run();
        assertThat(calls).hasValue(0);

        run.block();
        source.run().block();
        assertThat(calls).hasValue(2);
    }

    @Test
    void emptyFetchYieldsEmptyList() {
        EtfSource<String> source = EtfSource.of("Roundhill", Mono::empty, EtfSourceTest::parseCsv);

        StepVerifier.create(source.run())
                .assertNext(records -> assertThat(records).isEmpty())
                .verifyComplete();
    }

    @Test
    void fetchErrorsPropagateFromRun() {
        EtfSource<String> source = EtfSource.of("Roundhill",
                () -> Mono.error(new SourceFetchException("Roundhill", "HTTP 500", null)),
                EtfSourceTest::parseCsv);

        StepVerifier.create(source.run())
                .expectError(SourceFetchException.class)
                .verify();
    }

    @Test
    void rejectsMissingParts() {
        assertThatThrownBy(() -> EtfSource.of(null, Mono::empty, EtfSourceTest::parseCsv))
                .isInstanceOf(NullPointerException.class);
    }
}
