package dev.jobalerts;

import dev.jobalerts.model.CycleReport;
import dev.jobalerts.service.DiagnosticsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.util.Map;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
public class JobAlertsApplication implements CommandLineRunner {

  private static final String SEPARATOR = "========================================";

  private final PipelineRunner pipelineRunner;
  private final DiagnosticsService diagnosticsService;
  private final ExitManager exitManager;

  @Value("${alerts.mode:once}")
  private String mode = "once";

  public JobAlertsApplication(PipelineRunner pipelineRunner, DiagnosticsService diagnosticsService,
      ExitManager exitManager) {
    this.pipelineRunner = pipelineRunner;
    this.diagnosticsService = diagnosticsService;
    this.exitManager = exitManager;
  }

  public static void main(String[] args) {
    SpringApplication.run(JobAlertsApplication.class, args);
  }

  @Override
  public void run(String... args) {
    RunMode runMode = RunMode.fromConfig(mode).orElseGet(() -> {
      log.warn("Unknown alerts.mode '{}', running once", mode);
      return RunMode.ONCE;
    });

    log.info(SEPARATOR);
    log.info("Job Alerts Starting ({})", runMode);
    log.info(SEPARATOR);

    switch (runMode) {
      case SCHEDULED -> log.info("Scheduled mode - cycles run until shutdown");
      case ONCE -> runOnce();
      case TEST_SCRAPE -> testScrape();
      case TEST_NOTIFY -> testNotify();
    }
  }

  private void runOnce() {
    try {
      CycleReport report = pipelineRunner.execute();

      log.info(SEPARATOR);
      log.info("Job Alerts Completed Successfully");
      log.info("New postings: {}", report != null ? report.newCount() : 0);
      log.info(SEPARATOR);

      pipelineRunner.waitForMetricsScrape();
      exitManager.exit(0);
    } catch (Exception e) {
      log.error("Job Alerts failed: {}", e.getMessage(), e);
      exitManager.exit(1);
    }
  }

  private void testScrape() {
    try {
      diagnosticsService.testScrape().block();
      exitManager.exit(0);
    } catch (Exception e) {
      log.error("Test scrape failed: {}", e.getMessage(), e);
      exitManager.exit(1);
    }
  }

  private void testNotify() {
    try {
      Map<String, Boolean> results = diagnosticsService.testNotify().block();
      if (results == null || results.isEmpty()) {
        log.warn("No notification channel enabled");
      }
      exitManager.exit(0);
    } catch (Exception e) {
      log.error("Test notify failed: {}", e.getMessage(), e);
      exitManager.exit(1);
    }
  }
}
