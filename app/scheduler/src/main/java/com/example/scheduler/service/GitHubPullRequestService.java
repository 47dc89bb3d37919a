/*
 * Where: scheduler service layer
 * What: turns a repository's open pull requests and their check runs into OpenPullRequest values
 * Why: one broken repository or check lookup must not fail the whole notification run
 */
package com.example.scheduler.service;

import com.example.scheduler.model.CheckRun;
import com.example.scheduler.model.ChecksStatus;
import com.example.scheduler.model.OpenPullRequest;
import com.example.scheduler.model.RepositoryRef;
import com.example.scheduler.service.dto.GitHubLabelResponse;
import com.example.scheduler.service.dto.GitHubPullRequestResponse;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GitHubPullRequestService {

  private static final Logger logger = LoggerFactory.getLogger(GitHubPullRequestService.class);

  private final GitHubClient gitHubClient;
  private final CheckAggregator checkAggregator;
  private final SchedulerMetrics metrics;

  /** Never throws; a failed listing yields an empty list. */
  public List<OpenPullRequest> fetchOpenPullRequests(
      String accessToken, RepositoryRef repository) {
    logger.info("fetching open PRs repository={}", repository.fullName());
    try {
      final List<GitHubPullRequestResponse> pulls =
          gitHubClient.listOpenPullRequests(accessToken, repository);
      final List<OpenPullRequest> result = new ArrayList<>(pulls.size());
      for (GitHubPullRequestResponse pull : pulls) {
        final ChecksStatus checksStatus = fetchChecksStatus(accessToken, repository, pull);
        result.add(toOpenPullRequest(repository, pull, checksStatus));
      }
      logger.info("fetched open PRs repository={} count={}", repository.fullName(), result.size());
      return result;
    } catch (GitHubIntegrationException ex) {
      logger.error(
          "failed to fetch PRs repository={} reason={}",
          repository.fullName(),
          ex.reason(),
          ex);
      metrics.recordGitHubFetchFailure("pulls");
      return List.of();
    } catch (RuntimeException ex) {
      logger.error("unexpected error fetching PRs repository={}", repository.fullName(), ex);
      metrics.recordGitHubFetchFailure("pulls");
      return List.of();
    }
  }

  ChecksStatus fetchChecksStatus(
      String accessToken, RepositoryRef repository, GitHubPullRequestResponse pull) {
    final String sha = pull.headSha();
    if (sha == null || sha.isBlank()) {
      return ChecksStatus.PENDING;
    }
    try {
      final List<CheckRun> runs =
          gitHubClient.listCheckRuns(accessToken, repository, sha).stream()
              .map(run -> new CheckRun(run.status(), run.conclusion()))
              .toList();
      return checkAggregator.aggregate(runs);
    } catch (GitHubIntegrationException ex) {
      logger.warn(
          "failed to fetch check runs repository={} pr={} reason={}",
          repository.fullName(),
          pull.number(),
          ex.reason());
      metrics.recordGitHubFetchFailure("check_runs");
      return ChecksStatus.PENDING;
    } catch (RuntimeException ex) {
      logger.warn(
          "unexpected error fetching check runs repository={} pr={}",
          repository.fullName(),
          pull.number(),
          ex);
      metrics.recordGitHubFetchFailure("check_runs");
      return ChecksStatus.PENDING;
    }
  }

  private OpenPullRequest toOpenPullRequest(
      RepositoryRef repository, GitHubPullRequestResponse pull, ChecksStatus checksStatus) {
    final List<String> labels =
        pull.labels().stream()
            .map(GitHubLabelResponse::name)
            .filter(Objects::nonNull)
            .toList();
    return new OpenPullRequest(
        repository.organization(),
        repository.repository(),
        pull.number(),
        pull.title(),
        pull.user() == null ? null : pull.user().login(),
        pull.user() == null ? null : pull.user().avatarUrl(),
        labels,
        checksStatus,
        pull.htmlUrl(),
        parseCreatedAt(pull));
  }

  private Instant parseCreatedAt(GitHubPullRequestResponse pull) {
    if (pull.createdAt() == null) {
      return null;
    }
    try {
      return Instant.parse(pull.createdAt());
    } catch (DateTimeParseException ex) {
      logger.debug("unparseable created_at pr={} value={}", pull.number(), pull.createdAt());
      return null;
    }
  }
}
