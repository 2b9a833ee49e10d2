package dev.jobalerts;

import dev.jobalerts.model.CycleReport;
import dev.jobalerts.service.AlertPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Blocking entry point to a single alert cycle, shared by the one-shot mode and
 * the scheduler.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private final AlertPipelineService pipelineService;

  @Value("${alerts.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Runs one cycle and waits for it to finish.
   *
   * @return report of the cycle
   * @throws IllegalStateException if the cycle aborted
   */
  public CycleReport execute() {
    CycleReport report;
    try {
      report = pipelineService.runCycle().block();
    } catch (RuntimeException e) {
      log.error("Alert cycle failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Alert cycle failed", e);
    }
    if (report == null) {
      throw new IllegalStateException("Alert cycle completed without a report");
    }
    return report;
  }

  /**
   * Keep the process alive so Prometheus can scrape the last cycle's metrics.
   */
  public void waitForMetricsScrape() {
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
