/*
 * Where: scheduler poll loop
 * What: runs a schedule sync pass every scheduler.sync.poll-interval
 * Why: schedule edits made through the web API reach the job scheduler within one interval
 */
package com.example.scheduler.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "scheduler.sync.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ScheduleSyncWorker {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleSyncWorker.class);

  private final ScheduleReconciler scheduleReconciler;
  private final SchedulerMetrics metrics;

  @Scheduled(
      fixedDelayString = "${scheduler.sync.poll-interval:60s}",
      initialDelayString = "${scheduler.sync.poll-interval:60s}")
  public void run() {
    try {
      scheduleReconciler.sync();
    } catch (RuntimeException ex) {
      metrics.recordSyncPass("failed");
      logger.error("schedule sync pass failed; retrying on next poll", ex);
    }
  }
}
