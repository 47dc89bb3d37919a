/*
 * Where: scheduler service layer
 * What: makes the registered cron jobs match the active schedules in the database
 * Why: the web API edits schedules directly in the database and never calls this service
 */
package com.example.scheduler.service;

import com.example.scheduler.model.NotificationSchedule;
import com.example.scheduler.scheduling.JobScheduler;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScheduleReconciler {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleReconciler.class);

  private final ScheduleStore scheduleStore;
  private final JobScheduler jobScheduler;
  private final PullRequestNotificationJob notificationJob;
  private final SchedulerMetrics metrics;

  /**
   * Re-registers a job for every active schedule and removes jobs whose schedule is gone or
   * inactive. Safe to call repeatedly; a schedule that cannot be registered ends the pass without
   * a job.
   */
  public synchronized SyncResult sync() {
    final List<NotificationSchedule> activeSchedules = scheduleStore.listActiveSchedules();
    final Set<String> allScheduleIds = new HashSet<>(scheduleStore.listAllScheduleIds());
    final Set<String> registeredJobIds = jobScheduler.listJobIds();
    final Set<String> activeIds = new HashSet<>();

    int upserted = 0;
    int failed = 0;
    for (NotificationSchedule schedule : activeSchedules) {
      activeIds.add(schedule.id());
      try {
        upsert(schedule);
        upserted++;
      } catch (RuntimeException ex) {
        failed++;
        jobScheduler.removeJob(schedule.id());
        logger.error(
            "failed to register job; schedule skipped scheduleId={} cron='{}'",
            schedule.id(),
            schedule.cronExpression(),
            ex);
      }
    }

    int removed = 0;
    for (String jobId : registeredJobIds) {
      if (activeIds.contains(jobId)) {
        continue;
      }
      if (allScheduleIds.contains(jobId)) {
        logger.info("removing job for inactive schedule scheduleId={}", jobId);
      } else {
        logger.info("removing job for deleted schedule scheduleId={}", jobId);
      }
      if (jobScheduler.removeJob(jobId)) {
        removed++;
      }
    }

    final SyncResult result = new SyncResult(upserted, removed, failed);
    metrics.recordSyncPass(result.hasFailures() ? "partial" : "success");
    metrics.recordSyncFailedSchedules(failed);
    logger.info(
        "schedule sync finished active={} upserted={} removed={} failed={} jobs={}",
        activeSchedules.size(),
        upserted,
        removed,
        failed,
        jobScheduler.listJobIds().size());
    return result;
  }

  private void upsert(NotificationSchedule schedule) {
    final String scheduleId = schedule.id();
    jobScheduler.addJob(
        scheduleId, schedule.cronExpression(), () -> notificationJob.run(scheduleId));
  }
}
