/*
 * Where: scheduler service layer
 * What: records job run outcomes, skipped firings, sync passes, GitHub failures and email sends
 * Why: a silent scheduler is indistinguishable from a broken one without these counters
 */
package com.example.scheduler.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class SchedulerMetrics {

  static final String METRIC_JOB_RUNS = "scheduler.job.runs";
  static final String METRIC_JOB_SKIPPED = "scheduler.job.skipped";
  static final String METRIC_SYNC_PASSES = "scheduler.sync.passes";
  static final String METRIC_SYNC_FAILED_SCHEDULES = "scheduler.sync.failed.schedules";
  static final String METRIC_JOBS_REGISTERED = "scheduler.jobs.registered";
  static final String METRIC_GITHUB_FETCH_FAILURES = "scheduler.github.fetch.failures";
  static final String METRIC_EMAIL_SENDS = "scheduler.email.sends";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter syncFailedSchedules;

  public SchedulerMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.syncFailedSchedules =
        Counter.builder(METRIC_SYNC_FAILED_SCHEDULES)
            .description("Schedules that could not be registered during a sync pass")
            .register(meterRegistry);
  }

  public void recordJobRun(String result) {
    counter(METRIC_JOB_RUNS, "result", result, "Notification job run outcomes").increment();
  }

  public void recordJobSkipped(String reason) {
    counter(METRIC_JOB_SKIPPED, "reason", reason, "Job firings that were not executed")
        .increment();
  }

  public void recordSyncPass(String result) {
    counter(METRIC_SYNC_PASSES, "result", result, "Schedule sync pass outcomes").increment();
  }

  public void recordSyncFailedSchedules(int failed) {
    if (failed > 0) {
      syncFailedSchedules.increment(failed);
    }
  }

  public void recordGitHubFetchFailure(String call) {
    counter(METRIC_GITHUB_FETCH_FAILURES, "call", call, "Failed GitHub API calls").increment();
  }

  public void recordEmailSend(boolean sent) {
    counter(METRIC_EMAIL_SENDS, "result", sent ? "sent" : "failed", "Summary email sends")
        .increment();
  }

  public void bindRegisteredJobs(Map<String, ?> jobs) {
    Gauge.builder(METRIC_JOBS_REGISTERED, jobs, Map::size)
        .description("Jobs currently registered with the cron scheduler")
        .register(meterRegistry);
  }

  private Counter counter(String name, String tagKey, String tagValue, String description) {
    return counters.computeIfAbsent(
        name + ":" + tagValue,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of(tagKey, tagValue))
                .register(meterRegistry));
  }
}
