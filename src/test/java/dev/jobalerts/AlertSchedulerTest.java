package dev.jobalerts;

import dev.jobalerts.model.CycleReport;
import dev.jobalerts.service.PostingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertSchedulerTest {

  @Mock
  private PipelineRunner pipelineRunner;

  @Mock
  private PostingStore postingStore;

  @InjectMocks
  private AlertScheduler scheduler;

  @BeforeEach
  void setUp() {
    ReflectionTestUtils.setField(scheduler, "retentionDays", 90);
  }

  @Test
  void tick_runsCycleAndPrunesOldPostings() {
    when(pipelineRunner.execute()).thenReturn(CycleReport.builder().startedAt(Instant.now()).build());

    scheduler.tick();

    verify(pipelineRunner).execute();
    verify(postingStore).deleteOlderThan(90);
  }

  @Test
  void tick_skippedCycle_doesNotPrune() {
    when(pipelineRunner.execute()).thenReturn(CycleReport.skipped(Instant.now()));

    scheduler.tick();

    verify(postingStore, never()).deleteOlderThan(anyInt());
  }

  @Test
  void tick_retentionDisabled_doesNotPrune() {
    ReflectionTestUtils.setField(scheduler, "retentionDays", 0);
    when(pipelineRunner.execute()).thenReturn(CycleReport.builder().startedAt(Instant.now()).build());

    scheduler.tick();

    verifyNoInteractions(postingStore);
  }

  @Test
  void tick_failedCycle_isLoggedAndNextTickStillRuns() {
    when(pipelineRunner.execute())
        .thenThrow(new IllegalStateException("Alert cycle failed"))
        .thenReturn(CycleReport.builder().startedAt(Instant.now()).build());

    assertThatCode(scheduler::tick).doesNotThrowAnyException();
    scheduler.tick();

    verify(pipelineRunner, times(2)).execute();
    verify(postingStore).deleteOlderThan(90);
  }

  @Test
  void tick_afterShutdown_doesNothing() {
    scheduler.shutdown();

    scheduler.tick();

    assertThat(scheduler.isShuttingDown()).isTrue();
    verifyNoInteractions(pipelineRunner, postingStore);
  }
}
