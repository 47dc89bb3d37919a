/*
 * Where: scheduler service layer
 * What: one scheduled run: fetch open pull requests for every repository, cache them, email a summary
 * Why: each schedule firing is self-contained so a failed run is simply retried by the next firing
 */
package com.example.scheduler.service;

import com.example.common.MdcScope;
import com.example.common.RunIds;
import com.example.scheduler.model.NotificationSchedule;
import com.example.scheduler.model.OpenPullRequest;
import com.example.scheduler.model.RepositoryPullRequests;
import com.example.scheduler.model.RepositoryRef;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class PullRequestNotificationJob {

  private static final Logger logger = LoggerFactory.getLogger(PullRequestNotificationJob.class);

  static final String RESULT_COMPLETED = "completed";
  static final String RESULT_NOT_FOUND = "not_found";
  static final String RESULT_FAILED = "failed";

  private final ScheduleStore scheduleStore;
  private final GitHubPullRequestService gitHubPullRequestService;
  private final PullRequestSummaryFormatter summaryFormatter;
  private final EmailSender emailSender;
  private final SchedulerMetrics metrics;
  private final Executor fetchExecutor;

  public PullRequestNotificationJob(
      ScheduleStore scheduleStore,
      GitHubPullRequestService gitHubPullRequestService,
      PullRequestSummaryFormatter summaryFormatter,
      EmailSender emailSender,
      SchedulerMetrics metrics,
      @Qualifier("githubFetchExecutor") Executor fetchExecutor) {
    this.scheduleStore = scheduleStore;
    this.gitHubPullRequestService = gitHubPullRequestService;
    this.summaryFormatter = summaryFormatter;
    this.emailSender = emailSender;
    this.metrics = metrics;
    this.fetchExecutor = fetchExecutor;
  }

  public void run(String scheduleId) {
    final Map<String, String> context = new LinkedHashMap<>();
    context.put("schedule_id", scheduleId);
    context.put("run_id", RunIds.newRunId());
    try (MdcScope ignored = MdcScope.open(context)) {
      logger.info("notification job started scheduleId={}", scheduleId);
      try {
        final String result = execute(scheduleId);
        metrics.recordJobRun(result);
        logger.info("notification job finished scheduleId={} result={}", scheduleId, result);
      } catch (RuntimeException ex) {
        metrics.recordJobRun(RESULT_FAILED);
        throw ex;
      }
    }
  }

  private String execute(String scheduleId) {
    final Optional<NotificationSchedule> found = scheduleStore.getScheduleById(scheduleId);
    if (found.isEmpty()) {
      logger.warn("schedule not found; job skipped scheduleId={}", scheduleId);
      return RESULT_NOT_FOUND;
    }
    final NotificationSchedule schedule = found.get();

    final List<OpenPullRequest> pullRequests = new ArrayList<>();
    final Map<String, Integer> countsByRepository = new LinkedHashMap<>();
    for (RepositoryPullRequests fetched : fetchAll(schedule)) {
      final String repository = fetched.repository().fullName();
      if (fetched.pullRequests().isEmpty()) {
        logger.info("no open PRs repository={}", repository);
        continue;
      }
      pullRequests.addAll(fetched.pullRequests());
      countsByRepository.put(repository, fetched.pullRequests().size());
      logger.info(
          "open PRs found repository={} count={}", repository, fetched.pullRequests().size());
    }

    if (pullRequests.isEmpty()) {
      logger.info("no open PRs; cache and email skipped scheduleId={}", scheduleId);
      return RESULT_COMPLETED;
    }

    scheduleStore.replaceCachedPullRequests(scheduleId, pullRequests);
    notifyOwner(schedule, countsByRepository);
    return RESULT_COMPLETED;
  }

  private List<RepositoryPullRequests> fetchAll(NotificationSchedule schedule) {
    final List<RepositoryRef> repositories = schedule.repositories();
    if (repositories.isEmpty()) {
      return List.of();
    }
    final List<CompletableFuture<RepositoryPullRequests>> futures =
        repositories.stream().map(repository -> fetchAsync(schedule, repository)).toList();
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private CompletableFuture<RepositoryPullRequests> fetchAsync(
      NotificationSchedule schedule, RepositoryRef repository) {
    return CompletableFuture.supplyAsync(
            MdcScope.wrap(
                () ->
                    new RepositoryPullRequests(
                        repository,
                        gitHubPullRequestService.fetchOpenPullRequests(
                            schedule.githubPat(), repository))),
            fetchExecutor)
        .exceptionally(
            ex -> {
              logger.warn(
                  "repository fetch failed; treated as no open PRs repository={}",
                  repository.fullName(),
                  ex);
              return RepositoryPullRequests.empty(repository);
            });
  }

  private void notifyOwner(NotificationSchedule schedule, Map<String, Integer> countsByRepository) {
    if (!schedule.hasNotificationEmail()) {
      logger.warn(
          "no notification email; email skipped scheduleId={} userId={}",
          schedule.id(),
          schedule.userId());
      return;
    }
    final EmailMessage message = summaryFormatter.format(countsByRepository);
    final boolean sent =
        emailSender.send(schedule.notificationEmail(), message.subject(), message.body());
    metrics.recordEmailSend(sent);
    if (sent) {
      logger.info(
          "summary email sent scheduleId={} repositories={}",
          schedule.id(),
          countsByRepository.size());
    } else {
      logger.warn("summary email was not sent scheduleId={}", schedule.id());
    }
  }
}
