package dev.etfaggregator.service;

import dev.etfaggregator.entity.UpdateRun;
import dev.etfaggregator.model.RunResult;
import dev.etfaggregator.repository.UpdateRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Keeps a history of update runs in SQLite.
 * History writes never fail an update: errors are logged and dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunHistoryService {

    static final int MAX_ERROR_LENGTH = 2000;
    static final int MAX_LIMIT = 500;

    private final UpdateRunRepository updateRunRepository;

    /**
     * Append run results to the history.
     *
     * @return number of rows written, zero when the write failed
     */
    public int record(List<RunResult> results) {
        if (results.isEmpty()) {
            return 0;
        }
        try {
            List<UpdateRun> runs = results.stream()
                    .map(RunHistoryService::toEntity)
                    .toList();
            updateRunRepository.saveAll(runs);
            log.debug("Recorded {} update runs", runs.size());
            return runs.size();
        } catch (RuntimeException e) {
            log.warn("Failed to record update history: {}", e.getMessage());
            return 0;
        }
    }

    /**
     * Most recent runs, newest first.
     */
    public List<UpdateRun> recentRuns(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_LIMIT));
        return updateRunRepository.findAllByOrderByFinishedAtDesc(PageRequest.of(0, size));
    }

    static UpdateRun toEntity(RunResult result) {
        Instant finishedAt = result.finishedAt() != null ? result.finishedAt() : Instant.now();
        return UpdateRun.builder()
                .collection(result.collection())
                .outcome(result.outcome())
                .recordCount(result.count())
                .segmentCount(result.manifest() != null ? result.manifest().segmentCount() : null)
                .errorType(result.errorType())
                .error(truncate(result.error()))
                .finishedAt(LocalDateTime.ofInstant(finishedAt, ZoneOffset.UTC))
                .build();
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
