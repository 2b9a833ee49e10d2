package dev.jobalerts;

import dev.jobalerts.model.CycleReport;
import dev.jobalerts.service.PostingStore;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic trigger for {@code alerts.mode=scheduled}. Runs a cycle after the
 * initial delay and then a fixed delay after each cycle ends, so ticks never
 * overlap. A failed cycle is logged and retried on the next tick.
 */
@Slf4j
@Component
@EnableScheduling
@ConditionalOnProperty(name = "alerts.mode", havingValue = "scheduled")
@RequiredArgsConstructor
public class AlertScheduler {

  private final PipelineRunner pipelineRunner;
  private final PostingStore postingStore;

  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  @Value("${alerts.retention-days:0}")
  private int retentionDays;

  @Scheduled(fixedDelayString = "${alerts.polling.interval-ms:600000}",
      initialDelayString = "${alerts.polling.initial-delay-ms:0}")
  public void tick() {
    if (shuttingDown.get()) {
      log.info("Shutdown in progress - not starting a new cycle");
      return;
    }

    try {
      CycleReport report = pipelineRunner.execute();
      if (!report.isSkipped() && retentionDays > 0) {
        postingStore.deleteOlderThan(retentionDays);
      }
    } catch (RuntimeException e) {
      log.error("Scheduled cycle failed, retrying on next tick: {}", e.getMessage());
    }
  }

  @PreDestroy
  public void shutdown() {
    shuttingDown.set(true);
    log.info("Scheduler stopping");
  }

  boolean isShuttingDown() {
    return shuttingDown.get();
  }
}
