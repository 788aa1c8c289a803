package dev.etfaggregator.service;

import dev.etfaggregator.store.ChunkedStore;
import dev.etfaggregator.store.DatasetManifest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a stored dataset is recent enough to skip a refetch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FreshnessPolicy {

    private final ChunkedStore store;
    private final Clock clock;

    /**
     * True when the dataset's manifest exists and was written less than {@code within} ago.
     * A missing or unreadable manifest counts as stale.
     */
    public boolean isFresh(String collection, String kind, Duration within) {
        try {
            Instant updatedAt = store.manifest(collection, kind)
                    .map(DatasetManifest::getUpdatedAt)
                    .orElse(null);
            if (updatedAt == null) {
                return false;
            }
            return Duration.between(updatedAt, clock.instant()).compareTo(within) < 0;
        } catch (RuntimeException e) {
            log.warn("[{}] Cannot read manifest, treating dataset as stale: {}", collection, e.getMessage());
            return false;
        }
    }
}
