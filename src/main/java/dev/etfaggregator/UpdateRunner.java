package dev.etfaggregator;

import dev.etfaggregator.model.RunResult;
import dev.etfaggregator.model.UpdateSummary;
import dev.etfaggregator.service.UpdateOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * One-shot update of every source with a per-collection report.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UpdateRunner {

  private static final String SEPARATOR = "========================================";

  private final UpdateOrchestrator orchestrator;

  @Value("${aggregator.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Runs one update pass and waits for it to finish.
   *
   * @param force ignore dataset freshness
   * @return the pass summary
   */
  public UpdateSummary execute(boolean force) {
    log.info(SEPARATOR);
    log.info("Manual ETF update starting (force={})", force);
    log.info(SEPARATOR);

    try {
      UpdateSummary summary = orchestrator.updateAll(force).block();
      if (summary == null) {
        throw new IllegalStateException("Update finished without a summary");
      }

      for (RunResult result : summary.results()) {
        log.info("  {}", describe(result));
      }
      log.info(SEPARATOR);
      log.info("Sources: {} | succeeded: {} | skipped: {} | failed: {} | records: {}",
          summary.totalSources(), summary.succeeded(), summary.skipped(), summary.failed(),
          summary.totalRecords());
      log.info(SEPARATOR);

      handleMetricsWait();

      return summary;
    } catch (Exception e) {
      log.error("ETF update failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Update execution failed", e);
    }
  }

  static String describe(RunResult result) {
    switch (result.outcome()) {
      case SUCCEEDED:
        return "[OK]   " + result.collection() + ": " + result.count() + " records";
      case SKIPPED:
        return "[SKIP] " + result.collection() + ": " + result.reason();
      default:
        return "[FAIL] " + result.collection() + ": " + result.error();
    }
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
