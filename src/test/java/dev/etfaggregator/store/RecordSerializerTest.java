package dev.etfaggregator.store;

import dev.etfaggregator.model.DistributionFrequency;
import dev.etfaggregator.model.EtfRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordSerializerTest {

    private final RecordSerializer serializer = RecordSerializer.create();

    private static EtfRecord sample() {
        return EtfRecord.builder()
                .ticker("GSLC")
                .fundName("Goldman Sachs ActiveBeta U.S. Large Cap Equity ETF")
                .navAmount(new BigDecimal("105.10"))
                .navAsOf(LocalDate.of(2024, 4, 30))
                .distributionFrequency(DistributionFrequency.QUARTERLY)
                .build();
    }

    @Test
    @DisplayName("Should write compact snake_case JSON with decimals as strings and no nulls")
    void shouldWriteCompactJson() throws IOException {
        String json = new String(serializer.writeElement(sample(), SerializationFormat.JSON), StandardCharsets.UTF_8);

        assertThat(json)
                .contains("\"fund_name\":\"Goldman Sachs ActiveBeta U.S. Large Cap Equity ETF\"")
                .contains("\"nav_amount\":\"105.10\"")
                .contains("\"nav_as_of\":\"2024-04-30\"")
                .contains("\"distribution_frequency\":\"Quarterly\"")
                .doesNotContain("isin")
                .doesNotContain("\n")
                .doesNotContain(": ");
    }

    @Test
    @DisplayName("Should measure arrays exactly as the format predicts")
    void shouldPredictArraySize() throws IOException {
        List<EtfRecord> records = List.of(sample(), sample(), sample());
        long element = serializer.writeElement(sample(), SerializationFormat.JSON).length;

        assertThat((long) serializer.writeArray(records, SerializationFormat.JSON).length)
                .isEqualTo(SerializationFormat.JSON.arrayBytes(3, 3 * element));

        long binaryElement = serializer.writeElement(sample(), SerializationFormat.MSGPACK).length;
        assertThat((long) serializer.writeArray(records, SerializationFormat.MSGPACK).length)
                .isEqualTo(SerializationFormat.MSGPACK.arrayBytes(3, 3 * binaryElement));
    }

    @Test
    @DisplayName("Should tolerate unknown fields when reading records")
    void shouldIgnoreUnknownFields() throws IOException {
        byte[] json = "[{\"ticker\":\"IVV\",\"aum_millions\":1.5,\"distribution_frequency\":\"Bimonthly\"}]"
                .getBytes(StandardCharsets.UTF_8);

        List<EtfRecord> records = serializer.readArray(json, EtfRecord.class, SerializationFormat.JSON);

        assertThat(records).singleElement().satisfies(etf -> {
            assertThat(etf.getTicker()).isEqualTo("IVV");
            assertThat(etf.getDistributionFrequency()).isEqualTo(DistributionFrequency.UNKNOWN);
        });
    }

    @Test
    @DisplayName("Should write manifests as readable JSON")
    void shouldRoundTripManifest() throws IOException {
        DatasetManifest manifest = DatasetManifest.builder()
                .collection("ishares")
                .kind("listing")
                .updatedAt(Instant.parse("2024-05-01T22:00:00Z"))
                .recordCount(1000)
                .totalBytes(123_001)
                .format(SerializationFormat.JSON)
                .chunked(true)
                .chunkCount(2)
                .chunks(List.of(new SegmentInfo("listing_part0.json", 813, 100_000, "9e107d9d372bb6826bd81d3542a419d6"),
                        new SegmentInfo("listing_part1.json", 187, 23_001, null)))
                .build();

        byte[] bytes = serializer.writeManifest(manifest);

        assertThat(new String(bytes, StandardCharsets.UTF_8))
                .contains("\"updatedAt\" : \"2024-05-01T22:00:00Z\"")
                .contains("\"format\" : \"json\"");
        assertThat(serializer.readManifest(bytes)).isEqualTo(manifest);
    }

    @Test
    @DisplayName("Should reject an unknown format name")
    void shouldRejectUnknownFormat() {
        assertThatThrownBy(() -> SerializationFormat.fromExtension("yaml"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(SerializationFormat.fromExtension("MSGPACK")).isEqualTo(SerializationFormat.MSGPACK);
    }
}
