package com.example.scheduler.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Registers jobs for the schedules that already exist before the first poll interval elapses. */
@Component
@RequiredArgsConstructor
public class InitialScheduleSync implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(InitialScheduleSync.class);

  private final ScheduleReconciler scheduleReconciler;
  private final SchedulerMetrics metrics;

  @Override
  public void run(ApplicationArguments args) {
    try {
      final SyncResult result = scheduleReconciler.sync();
      logger.info(
          "initial schedule sync done upserted={} failed={}", result.upserted(), result.failed());
    } catch (RuntimeException ex) {
      metrics.recordSyncPass("failed");
      logger.error("initial schedule sync failed; the poll loop will retry", ex);
    }
  }
}
