package dev.jobalerts;

import dev.jobalerts.model.CycleReport;
import dev.jobalerts.service.AlertPipelineService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

  @Mock
  private AlertPipelineService pipelineService;

  @InjectMocks
  private PipelineRunner pipelineRunner;

  @BeforeEach
  void setUp() {
    ReflectionTestUtils.setField(pipelineRunner, "metricsWaitSeconds", 0);
  }

  @Test
  void execute_successfulRun_returnsReport() {
    CycleReport report = CycleReport.builder()
        .startedAt(Instant.now())
        .finishedAt(Instant.now())
        .collected(5)
        .build();
    when(pipelineService.runCycle()).thenReturn(Mono.just(report));

    CycleReport result = pipelineRunner.execute();

    assertThat(result).isSameAs(report);
    verify(pipelineService).runCycle();
  }

  @Test
  void execute_skippedCycle_returnsSkippedReport() {
    when(pipelineService.runCycle()).thenReturn(Mono.just(CycleReport.skipped(Instant.now())));

    assertThat(pipelineRunner.execute().isSkipped()).isTrue();
  }

  @Test
  void execute_storeFailure_wrapsInIllegalState() {
    when(pipelineService.runCycle())
        .thenReturn(Mono.error(new DataAccessResourceFailureException("database is locked")));

    assertThatThrownBy(() -> pipelineRunner.execute())
        .isInstanceOf(IllegalStateException.class)
        .hasCauseInstanceOf(DataAccessResourceFailureException.class);
  }

  @Test
  void execute_emptyResult_throws() {
    when(pipelineService.runCycle()).thenReturn(Mono.empty());

    assertThatThrownBy(() -> pipelineRunner.execute()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void waitForMetricsScrape_withWait_returns() {
    ReflectionTestUtils.setField(pipelineRunner, "metricsWaitSeconds", 1);

    pipelineRunner.waitForMetricsScrape();

    verifyNoInteractions(pipelineService);
  }
}
