package dev.jobalerts;

import dev.jobalerts.model.CycleReport;
import dev.jobalerts.service.DiagnosticsService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobAlertsApplicationTests {

  @Mock
  private PipelineRunner pipelineRunner;

  @Mock
  private DiagnosticsService diagnosticsService;

  @Mock
  private ExitManager exitManager;

  private JobAlertsApplication app(String mode) {
    JobAlertsApplication app = new JobAlertsApplication(pipelineRunner, diagnosticsService, exitManager);
    ReflectionTestUtils.setField(app, "mode", mode);
    return app;
  }

  @Test
  void shouldRunOneCycleAndExitSuccessfully() {
    when(pipelineRunner.execute()).thenReturn(CycleReport.builder().startedAt(Instant.now()).build());

    app("once").run();

    verify(pipelineRunner).execute();
    verify(pipelineRunner).waitForMetricsScrape();
    verify(exitManager).exit(0);
  }

  @Test
  void shouldHandleExceptionAndExitWithError() {
    when(pipelineRunner.execute()).thenThrow(new IllegalStateException("Fatal"));

    app("once").run();

    verify(exitManager).exit(1);
  }

  @Test
  void shouldNotRunOrExitInScheduledMode() {
    app("scheduled").run();

    verifyNoInteractions(pipelineRunner, exitManager);
  }

  @Test
  void shouldRunTestScrape() {
    when(diagnosticsService.testScrape()).thenReturn(Mono.just(List.of()));

    app("test-scrape").run();

    verify(diagnosticsService).testScrape();
    verify(exitManager).exit(0);
    verifyNoInteractions(pipelineRunner);
  }

  @Test
  void shouldRunTestNotify() {
    when(diagnosticsService.testNotify()).thenReturn(Mono.just(Map.of("Email", true)));

    app("test-notify").run();

    verify(exitManager).exit(0);
  }

  @Test
  void shouldFallBackToOnceForUnknownMode() {
    when(pipelineRunner.execute()).thenReturn(CycleReport.builder().startedAt(Instant.now()).build());

    app("continuous").run();

    verify(pipelineRunner).execute();
    verify(exitManager).exit(0);
  }

  @Test
  void shouldResolveRunModes() {
    assertThat(RunMode.fromConfig("test-scrape")).contains(RunMode.TEST_SCRAPE);
    assertThat(RunMode.fromConfig("SCHEDULED")).contains(RunMode.SCHEDULED);
    assertThat(RunMode.fromConfig(null)).contains(RunMode.ONCE);
    assertThat(RunMode.fromConfig("daemon")).isEmpty();
  }
}
