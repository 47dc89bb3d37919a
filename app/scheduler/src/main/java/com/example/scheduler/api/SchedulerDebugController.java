/*
 * Where: scheduler debug API
 * What: lists registered jobs and a schedule's cached pull request snapshot
 * Why: lets operators confirm what the scheduler believes without reading the database
 */
package com.example.scheduler.api;

import com.example.scheduler.model.CachedPullRequest;
import com.example.scheduler.scheduling.JobScheduler;
import com.example.scheduler.service.ScheduleStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/scheduler")
@RequiredArgsConstructor
public class SchedulerDebugController {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerDebugController.class);

  private static final TypeReference<List<String>> LABELS = new TypeReference<>() {};
  private static final int MAX_PREVIEW = 50;

  private final JobScheduler jobScheduler;
  private final ScheduleStore scheduleStore;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @GetMapping("/jobs")
  public List<JobSummary> jobs() {
    return jobScheduler.listJobs().stream()
        .map(job -> new JobSummary(job.jobId(), job.cronExpression(), job.nextFireTime()))
        .toList();
  }

  /** Previews the next fire times of a 5-field cron expression in the scheduler's zone. */
  @GetMapping("/cron/next-fire-times")
  public List<ZonedDateTime> nextFireTimes(
      @RequestParam("expression") String expression,
      @RequestParam(name = "count", defaultValue = "5") int count) {
    if (count < 1 || count > MAX_PREVIEW) {
      throw new IllegalArgumentException("count must be between 1 and " + MAX_PREVIEW);
    }
    final List<ZonedDateTime> fireTimes = new ArrayList<>(count);
    Instant after = clock.instant();
    for (int i = 0; i < count; i++) {
      final Optional<ZonedDateTime> next = jobScheduler.nextFireTime(expression, after);
      if (next.isEmpty()) {
        break;
      }
      fireTimes.add(next.get());
      after = next.get().toInstant();
    }
    return fireTimes;
  }

  @GetMapping("/schedules/{scheduleId}/pulls")
  public CachedPullRequestsResponse pulls(@PathVariable("scheduleId") String scheduleId) {
    final List<CachedPullRequestSummary> items =
        scheduleStore.findCachedPullRequests(scheduleId).stream().map(this::toSummary).toList();
    return new CachedPullRequestsResponse(scheduleId, items);
  }

  private CachedPullRequestSummary toSummary(CachedPullRequest row) {
    return new CachedPullRequestSummary(
        row.organization(),
        row.repository(),
        row.prNumber(),
        row.title(),
        row.author(),
        row.authorAvatarUrl(),
        parseLabels(row.labelsJson()),
        row.checksStatus(),
        row.htmlUrl(),
        row.createdAt(),
        row.cachedAt());
  }

  private List<String> parseLabels(String labelsJson) {
    if (labelsJson == null || labelsJson.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(labelsJson, LABELS);
    } catch (JsonProcessingException ex) {
      logger.warn("cached labels are not a JSON array; returned as empty labels={}", labelsJson);
      return List.of();
    }
  }
}
