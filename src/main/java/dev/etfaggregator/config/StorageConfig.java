package dev.etfaggregator.config;

import dev.etfaggregator.store.ChunkedStore;
import dev.etfaggregator.store.RecordSerializer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RecordSerializer recordSerializer() {
        return RecordSerializer.create();
    }

    @Bean
    public ChunkedStore chunkedStore(AggregatorProperties properties, RecordSerializer serializer, Clock clock) {
        AggregatorProperties.Storage storage = properties.getStorage();
        Path root = Path.of(storage.getRoot());
        log.info("Data lake at {} (segment ceiling {} bytes, format {})",
                root.toAbsolutePath(), storage.getMaxSegmentBytes(), storage.getFormat().extension());
        return new ChunkedStore(root, storage.getMaxSegmentBytes(), serializer, clock);
    }
}
