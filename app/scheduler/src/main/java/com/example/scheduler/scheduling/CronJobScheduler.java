/*
 * Where: scheduler scheduling layer
 * What: runs registered cron jobs on a worker pool with coalescing, misfire grace and one run per id
 * Why: a schedule must never overlap itself and late firings after a stall must not pile up
 */
package com.example.scheduler.scheduling;

import com.example.scheduler.config.SchedulerProperties;
import com.example.scheduler.service.SchedulerMetrics;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

@Component
public class CronJobScheduler implements JobScheduler, SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(CronJobScheduler.class);

  private final SchedulerMetrics metrics;
  private final Clock clock;
  private final ZoneId zone;
  private final Duration misfireGraceTime;
  private final Duration shutdownTimeout;
  private final ThreadPoolTaskScheduler taskScheduler;
  private final ConcurrentMap<String, JobEntry> jobs = new ConcurrentHashMap<>();
  // keyed by job id, not entry, so a replaced job cannot overlap its predecessor
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
  private final Object monitor = new Object();
  private volatile boolean running;

  public CronJobScheduler(SchedulerProperties properties, SchedulerMetrics metrics, Clock clock) {
    this.metrics = metrics;
    this.clock = clock;
    this.zone = properties.zoneId();
    this.misfireGraceTime = properties.misfireGraceTime();
    this.shutdownTimeout = properties.shutdownTimeout();
    this.taskScheduler = new ThreadPoolTaskScheduler();
    taskScheduler.setPoolSize(properties.executorPoolSize());
    taskScheduler.setThreadNamePrefix("notification-job-");
    taskScheduler.setRemoveOnCancelPolicy(true);
    taskScheduler.setClock(clock);
    metrics.bindRegisteredJobs(jobs);
  }

  @Override
  public ScheduledJob addJob(String jobId, String cronExpression, Runnable task) {
    requireJobId(jobId);
    Objects.requireNonNull(task, "task");
    final CronExpression cron = CronExpressions.parseStandard(cronExpression);
    final JobEntry entry = new JobEntry(jobId, cronExpression, cron, task);
    final JobEntry previous;
    final Instant carriedFireTime;
    synchronized (monitor) {
      final Instant now = clock.instant();
      previous = jobs.get(jobId);
      // a due trigger still waiting for a worker must survive the replacement
      carriedFireTime = running && previous != null ? previous.pendingDueFireTime(now) : null;
      entry.nextFireTime = carriedFireTime != null ? carriedFireTime : computeNext(cron, now);
      jobs.put(jobId, entry);
      if (previous != null) {
        previous.cancel();
      }
      if (running) {
        scheduleAt(entry, entry.nextFireTime);
      }
    }
    if (carriedFireTime != null) {
      logger.info(
          "pending firing carried over to replaced job jobId={} scheduledTime={}",
          jobId,
          carriedFireTime);
    }
    logger.debug(
        "job {} jobId={} cron='{}' nextFireTime={}",
        previous == null ? "added" : "replaced",
        jobId,
        cronExpression,
        entry.nextFireTime);
    return entry.view();
  }

  @Override
  public boolean removeJob(String jobId) {
    final JobEntry removed;
    synchronized (monitor) {
      removed = jobs.remove(jobId);
      if (removed != null) {
        removed.cancel();
      }
    }
    if (removed == null) {
      return false;
    }
    logger.info("job removed jobId={}", jobId);
    return true;
  }

  @Override
  public Set<String> listJobIds() {
    return Set.copyOf(jobs.keySet());
  }

  @Override
  public List<ScheduledJob> listJobs() {
    return jobs.values().stream()
        .map(JobEntry::view)
        .sorted(Comparator.comparing(ScheduledJob::jobId))
        .toList();
  }

  @Override
  public Optional<ScheduledJob> getJob(String jobId) {
    return Optional.ofNullable(jobs.get(jobId)).map(JobEntry::view);
  }

  @Override
  public Optional<ZonedDateTime> nextFireTime(String cronExpression, Instant after) {
    final CronExpression cron = CronExpressions.parseStandard(cronExpression);
    return Optional.ofNullable(cron.next(after.atZone(zone)));
  }

  @Override
  public void start() {
    synchronized (monitor) {
      if (running) {
        return;
      }
      taskScheduler.initialize();
      running = true;
      final Instant now = clock.instant();
      for (JobEntry entry : jobs.values()) {
        entry.nextFireTime = computeNext(entry.cron, now);
        scheduleAt(entry, entry.nextFireTime);
      }
    }
    logger.info(
        "job scheduler started zone={} jobs={} misfireGraceTime={}",
        zone,
        jobs.size(),
        misfireGraceTime);
  }

  @Override
  public void stop() {
    shutdown(true);
  }

  @Override
  public void shutdown(boolean waitForRunningJobs) {
    synchronized (monitor) {
      if (!running) {
        return;
      }
      running = false;
      jobs.values().forEach(JobEntry::cancelTrigger);
    }
    logger.info(
        "job scheduler shutting down wait={} inFlight={}", waitForRunningJobs, inFlight.size());
    taskScheduler.setWaitForTasksToCompleteOnShutdown(waitForRunningJobs);
    taskScheduler.setAwaitTerminationMillis(waitForRunningJobs ? shutdownTimeout.toMillis() : 0L);
    taskScheduler.shutdown();
    logger.info("job scheduler stopped inFlight={}", inFlight.size());
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /** Fires the registered job as if its trigger went off for {@code scheduledTime}. */
  @VisibleForTesting
  void fire(String jobId, Instant scheduledTime) {
    final JobEntry entry = jobs.get(jobId);
    if (entry != null) {
      onTrigger(entry, scheduledTime);
    }
  }

  private void onTrigger(JobEntry entry, Instant scheduledTime) {
    final Instant now = clock.instant();
    synchronized (monitor) {
      if (entry.cancelled || jobs.get(entry.jobId) != entry) {
        return;
      }
      // next fire is computed from now, so firings missed while stalled collapse into this one
      final Instant after = now.isAfter(scheduledTime) ? now : scheduledTime;
      entry.nextFireTime = computeNext(entry.cron, after);
      if (running) {
        scheduleAt(entry, entry.nextFireTime);
      }
    }
    final Duration lateness = Duration.between(scheduledTime, now);
    if (lateness.compareTo(misfireGraceTime) > 0) {
      logger.warn(
          "job run skipped past misfire grace time jobId={} scheduledTime={} lateness={}",
          entry.jobId,
          scheduledTime,
          lateness);
      metrics.recordJobSkipped("misfire");
      return;
    }
    runExclusive(entry);
  }

  private void runExclusive(JobEntry entry) {
    if (!inFlight.add(entry.jobId)) {
      logger.warn("job run skipped because a previous run is still active jobId={}", entry.jobId);
      metrics.recordJobSkipped("max_instances");
      return;
    }
    try {
      entry.task.run();
    } catch (RuntimeException ex) {
      logger.error("job run raised an exception jobId={}", entry.jobId, ex);
    } finally {
      inFlight.remove(entry.jobId);
    }
  }

  private void scheduleAt(JobEntry entry, Instant fireTime) {
    if (fireTime == null) {
      logger.warn(
          "job has no future fire time jobId={} cron='{}'", entry.jobId, entry.cronExpression);
      return;
    }
    try {
      entry.future = taskScheduler.schedule(() -> onTrigger(entry, fireTime), fireTime);
    } catch (TaskRejectedException ex) {
      logger.warn("job trigger rejected jobId={} fireTime={}", entry.jobId, fireTime, ex);
    }
  }

  private Instant computeNext(CronExpression cron, Instant after) {
    final ZonedDateTime next = cron.next(after.atZone(zone));
    return next == null ? null : next.toInstant();
  }

  private static void requireJobId(String jobId) {
    if (jobId == null || jobId.isBlank()) {
      throw new IllegalArgumentException("jobId is required");
    }
  }

  private static final class JobEntry {
    private final String jobId;
    private final String cronExpression;
    private final CronExpression cron;
    private final Runnable task;
    private volatile ScheduledFuture<?> future;
    private volatile Instant nextFireTime;
    private volatile boolean cancelled;

    private JobEntry(String jobId, String cronExpression, CronExpression cron, Runnable task) {
      this.jobId = jobId;
      this.cronExpression = cronExpression;
      this.cron = cron;
      this.task = task;
    }

    /** Fire time of a trigger that is due but has not started yet, or null. */
    private Instant pendingDueFireTime(Instant now) {
      final ScheduledFuture<?> current = future;
      final Instant fireTime = nextFireTime;
      if (current == null || current.isDone() || fireTime == null || fireTime.isAfter(now)) {
        return null;
      }
      return fireTime;
    }

    private void cancel() {
      cancelled = true;
      cancelTrigger();
    }

    private void cancelTrigger() {
      final ScheduledFuture<?> current = future;
      if (current != null) {
        current.cancel(false);
      }
    }

    private ScheduledJob view() {
      return new ScheduledJob(jobId, cronExpression, nextFireTime);
    }
  }
}
