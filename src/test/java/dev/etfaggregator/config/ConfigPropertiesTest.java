package dev.etfaggregator.config;

import dev.etfaggregator.ShutdownManager;
import dev.etfaggregator.UpdateRunner;
import dev.etfaggregator.source.EtfSource;
import dev.etfaggregator.store.ChunkedStore;
import dev.etfaggregator.store.SerializationFormat;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ConfigPropertiesTest {

  @MockitoBean
  private UpdateRunner updateRunner;

  @MockitoBean
  private ShutdownManager shutdownManager;

  @Autowired
  private AggregatorProperties properties;

  @Autowired
  private SourcesConfig sourcesConfig;

  @Autowired
  private ChunkedStore chunkedStore;

  @Autowired
  private List<EtfSource<?>> sources;

  @Test
  void shouldLoadAggregatorProperties() {
    assertThat(properties.getFreshnessWindow()).isEqualTo(Duration.ofHours(24));
    assertThat(properties.getSourceTimeout()).isEqualTo(Duration.ofMinutes(2));
    assertThat(properties.isRunOnce()).isFalse();
    assertThat(properties.getStorage().getFormat()).isEqualTo(SerializationFormat.JSON);
    assertThat(properties.getScheduler().isEnabled()).isFalse();
    assertThat(properties.getScheduler().getZone()).isEqualTo("America/New_York");
  }

  @Test
  void shouldLoadSourcesConfig() {
    assertThat(sourcesConfig.getIshares().getUrl()).isEqualTo("http://localhost:1/ishares");
    assertThat(sourcesConfig.getIshares().getTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(sourcesConfig.getAlphaArchitect().isEnabled()).isFalse();
    assertThat(sourcesConfig.getEnabledCount()).isEqualTo(2);
  }

  @Test
  void shouldWireStoreAndSources() {
    assertThat(chunkedStore.getMaxSegmentBytes()).isEqualTo(100_000);
    assertThat(chunkedStore.getRoot().toString()).endsWith("test-data-lake");
    assertThat(sources).extracting(EtfSource::identity)
        .containsExactlyInAnyOrder("iShares", "GoldmanSachs", "Alpha Architect");
  }
}
