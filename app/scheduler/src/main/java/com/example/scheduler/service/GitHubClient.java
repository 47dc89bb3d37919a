/*
 * Where: scheduler service layer
 * What: calls the GitHub REST API for open pull requests and commit check runs
 * Why: keeps headers, paging and error classification in one place
 */
package com.example.scheduler.service;

import com.example.scheduler.config.GitHubClientProperties;
import com.example.scheduler.model.RepositoryRef;
import com.example.scheduler.service.dto.GitHubCheckRunResponse;
import com.example.scheduler.service.dto.GitHubCheckRunsResponse;
import com.example.scheduler.service.dto.GitHubPullRequestResponse;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class GitHubClient {

  private static final Logger logger = LoggerFactory.getLogger(GitHubClient.class);

  static final String PULLS_PATH = "/repos/{org}/{repo}/pulls?state=open&per_page={perPage}";
  static final String CHECK_RUNS_PATH =
      "/repos/{org}/{repo}/commits/{sha}/check-runs?per_page={perPage}";
  static final String GITHUB_JSON = "application/vnd.github+json";
  static final String API_VERSION_HEADER = "X-GitHub-Api-Version";
  static final String API_VERSION = "2022-11-28";

  private static final ParameterizedTypeReference<List<GitHubPullRequestResponse>> PULL_LIST =
      new ParameterizedTypeReference<>() {};

  private final RestClient githubRestClient;
  private final GitHubClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component")
  public GitHubClient(RestClient githubRestClient, GitHubClientProperties properties) {
    this.githubRestClient = githubRestClient;
    this.properties = properties;
  }

  /** Lists open pull requests, following {@code Link: rel="next"} up to github.max-pages. */
  public List<GitHubPullRequestResponse> listOpenPullRequests(
      String accessToken, RepositoryRef repository) {
    final List<GitHubPullRequestResponse> pulls = new ArrayList<>();
    URI nextPage = null;
    int page = 0;
    do {
      final ResponseEntity<List<GitHubPullRequestResponse>> response =
          fetchPullRequestPage(accessToken, repository, nextPage);
      if (response.getBody() == null) {
        throw new GitHubIntegrationException(
            GitHubIntegrationException.Reason.INVALID_RESPONSE,
            "pull request list body is empty for " + repository.fullName());
      }
      pulls.addAll(response.getBody());
      page++;
      nextPage = nextPageUri(response.getHeaders());
    } while (nextPage != null && page < properties.maxPages());
    if (nextPage != null) {
      logger.warn(
          "github pull request listing truncated repository={} pages={} fetched={}",
          repository.fullName(),
          page,
          pulls.size());
    }
    return pulls;
  }

  public List<GitHubCheckRunResponse> listCheckRuns(
      String accessToken, RepositoryRef repository, String sha) {
    final GitHubCheckRunsResponse response =
        call(
            "listCheckRuns",
            () ->
                githubRestClient
                    .get()
                    .uri(
                        CHECK_RUNS_PATH,
                        repository.organization(),
                        repository.repository(),
                        sha,
                        properties.pageSize())
                    .headers(headers -> applyHeaders(headers, accessToken))
                    .retrieve()
                    .body(GitHubCheckRunsResponse.class));
    if (response == null) {
      throw new GitHubIntegrationException(
          GitHubIntegrationException.Reason.INVALID_RESPONSE,
          "check runs body is empty for " + repository.fullName() + "@" + sha);
    }
    return response.checkRuns();
  }

  private ResponseEntity<List<GitHubPullRequestResponse>> fetchPullRequestPage(
      String accessToken, RepositoryRef repository, URI nextPage) {
    return call(
        "listOpenPullRequests",
        () -> {
          final RestClient.RequestHeadersSpec<?> request =
              nextPage == null
                  ? githubRestClient
                      .get()
                      .uri(
                          PULLS_PATH,
                          repository.organization(),
                          repository.repository(),
                          properties.pageSize())
                  : githubRestClient.get().uri(nextPage);
          return request
              .headers(headers -> applyHeaders(headers, accessToken))
              .retrieve()
              .toEntity(PULL_LIST);
        });
  }

  private void applyHeaders(HttpHeaders headers, String accessToken) {
    headers.set(HttpHeaders.ACCEPT, GITHUB_JSON);
    headers.set(API_VERSION_HEADER, API_VERSION);
    headers.setBearerAuth(accessToken);
  }

  private <T> T call(String operation, GitHubCall<T> call) {
    try {
      return call.execute();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(operation, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(operation, ex);
    } catch (RestClientException ex) {
      logger.warn("github {} response could not be read", operation, ex);
      throw new GitHubIntegrationException(
          GitHubIntegrationException.Reason.INVALID_RESPONSE,
          "github response parse failed",
          ex);
    }
  }

  private GitHubIntegrationException mapResponseException(
      String operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "github {} failed with http status={} statusText={}",
        operation,
        status,
        ex.getStatusText());
    if (status == 404) {
      return new GitHubIntegrationException(
          GitHubIntegrationException.Reason.NOT_FOUND, "github resource not found", ex);
    }
    if (status == 429 || (status == 403 && isRateLimitExhausted(ex.getResponseHeaders()))) {
      return new GitHubIntegrationException(
          GitHubIntegrationException.Reason.RATE_LIMITED, "github rate limit exceeded", ex);
    }
    if (status == 401 || status == 403) {
      return new GitHubIntegrationException(
          GitHubIntegrationException.Reason.UNAUTHORIZED, "github rejected the token", ex);
    }
    return new GitHubIntegrationException(
        GitHubIntegrationException.Reason.BAD_GATEWAY, "github request failed", ex);
  }

  private GitHubIntegrationException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("github {} timed out", operation);
      return new GitHubIntegrationException(
          GitHubIntegrationException.Reason.TIMEOUT, "github request timeout", ex);
    }
    logger.warn("github {} connection failed", operation, ex);
    return new GitHubIntegrationException(
        GitHubIntegrationException.Reason.BAD_GATEWAY, "github connection failed", ex);
  }

  private boolean isRateLimitExhausted(HttpHeaders headers) {
    return headers != null && "0".equals(headers.getFirst("X-RateLimit-Remaining"));
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  @VisibleForTesting
  static URI nextPageUri(HttpHeaders headers) {
    final String link = headers.getFirst(HttpHeaders.LINK);
    if (link == null || link.isBlank()) {
      return null;
    }
    for (String part : link.split(",")) {
      final String[] segments = part.split(";");
      if (segments.length < 2) {
        continue;
      }
      final String target = segments[0].trim();
      boolean next = false;
      for (int i = 1; i < segments.length; i++) {
        if (segments[i].trim().equals("rel=\"next\"")) {
          next = true;
        }
      }
      if (next && target.startsWith("<") && target.endsWith(">")) {
        return URI.create(target.substring(1, target.length() - 1));
      }
    }
    return null;
  }

  @FunctionalInterface
  private interface GitHubCall<T> {
    T execute();
  }
}
