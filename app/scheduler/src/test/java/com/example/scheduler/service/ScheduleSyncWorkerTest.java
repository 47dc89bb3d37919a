package com.example.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ScheduleSyncWorkerTest {

  @Mock private ScheduleReconciler scheduleReconciler;

  @Test
  void runsOneSyncPass() {
    when(scheduleReconciler.sync()).thenReturn(new SyncResult(1, 0, 0));
    final ScheduleSyncWorker worker =
        new ScheduleSyncWorker(scheduleReconciler, new SchedulerMetrics(new SimpleMeterRegistry()));

    worker.run();

    verify(scheduleReconciler).sync();
  }

  @Test
  void failedPassIsRecordedAndSwallowed() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    when(scheduleReconciler.sync())
        .thenThrow(new DataAccessResourceFailureException("database unavailable"));
    final ScheduleSyncWorker worker =
        new ScheduleSyncWorker(scheduleReconciler, new SchedulerMetrics(registry));

    assertThatCode(worker::run).doesNotThrowAnyException();
    assertThat(registry.get("scheduler.sync.passes").tag("result", "failed").counter().count())
        .isEqualTo(1.0d);
  }
}
