/*
 * Where: scheduler scheduling layer
 * What: registry of cron-triggered jobs keyed by schedule id
 * Why: the reconciler and the debug API talk to the scheduler only through this seam
 */
package com.example.scheduler.scheduling;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface JobScheduler {

  /**
   * Registers a job, replacing any job with the same id.
   *
   * @throws InvalidCronExpressionException if the expression cannot be parsed; nothing is
   *     registered or replaced in that case
   */
  ScheduledJob addJob(String jobId, String cronExpression, Runnable task);

  /** Returns whether a job with that id was registered. */
  boolean removeJob(String jobId);

  Set<String> listJobIds();

  List<ScheduledJob> listJobs();

  Optional<ScheduledJob> getJob(String jobId);

  /** Next time the expression fires strictly after {@code after}, in the scheduler's zone. */
  Optional<ZonedDateTime> nextFireTime(String cronExpression, Instant after);

  void start();

  void shutdown(boolean waitForRunningJobs);

  boolean isRunning();
}
