package com.example.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.scheduler.config.GitHubClientProperties;
import com.example.scheduler.model.RepositoryRef;
import com.example.scheduler.service.dto.GitHubCheckRunResponse;
import com.example.scheduler.service.dto.GitHubLabelResponse;
import com.example.scheduler.service.dto.GitHubPullRequestResponse;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class GitHubClientTest {

  private static final RepositoryRef FRONTEND = new RepositoryRef("myorg", "frontend");
  private static final String PULLS_URL =
      "http://github.test/repos/myorg/frontend/pulls?state=open&per_page=100";
  private static final String PAGE_TWO_URL =
      "http://github.test/repositories/42/pulls?state=open&per_page=100&page=2";

  @Test
  void listOpenPullRequestsSendsGitHubHeaders() {
    final ClientFixture fixture = newFixture(10);
    fixture
        .server
        .expect(requestTo(PULLS_URL))
        .andExpect(method(GET))
        .andExpect(header("Authorization", "Bearer ghp_token"))
        .andExpect(header("Accept", "application/vnd.github+json"))
        .andExpect(header("X-GitHub-Api-Version", "2022-11-28"))
        .andRespond(withSuccess(pullsJson(1, 2), MediaType.APPLICATION_JSON));

    final List<GitHubPullRequestResponse> pulls =
        fixture.client.listOpenPullRequests("ghp_token", FRONTEND);

    fixture.server.verify();
    assertThat(pulls).extracting(GitHubPullRequestResponse::number).containsExactly(1, 2);
    final GitHubPullRequestResponse first = pulls.get(0);
    assertThat(first.title()).isEqualTo("PR 1");
    assertThat(first.user().login()).isEqualTo("alice");
    assertThat(first.user().avatarUrl()).isEqualTo("https://avatars.example.com/alice");
    assertThat(first.labels()).extracting(GitHubLabelResponse::name).containsExactly("bug");
    assertThat(first.headSha()).isEqualTo("sha1");
    assertThat(first.htmlUrl()).isEqualTo("https://github.com/myorg/frontend/pull/1");
    assertThat(first.createdAt()).isEqualTo("2026-03-01T10:00:00Z");
  }

  @Test
  void listOpenPullRequestsFollowsNextLink() {
    final ClientFixture fixture = newFixture(10);
    final HttpHeaders firstPageHeaders = new HttpHeaders();
    firstPageHeaders.add(
        HttpHeaders.LINK,
        "<" + PAGE_TWO_URL + ">; rel=\"next\", <" + PAGE_TWO_URL + ">; rel=\"last\"");
    fixture
        .server
        .expect(requestTo(PULLS_URL))
        .andRespond(
            withSuccess(pullsJson(1, 2), MediaType.APPLICATION_JSON).headers(firstPageHeaders));
    fixture
        .server
        .expect(requestTo(PAGE_TWO_URL))
        .andExpect(header("Authorization", "Bearer ghp_token"))
        .andRespond(withSuccess(pullsJson(3), MediaType.APPLICATION_JSON));

    final List<GitHubPullRequestResponse> pulls =
        fixture.client.listOpenPullRequests("ghp_token", FRONTEND);

    fixture.server.verify();
    assertThat(pulls).extracting(GitHubPullRequestResponse::number).containsExactly(1, 2, 3);
  }

  @Test
  void listOpenPullRequestsStopsAtMaxPages() {
    final ClientFixture fixture = newFixture(1);
    final HttpHeaders headers = new HttpHeaders();
    headers.add(HttpHeaders.LINK, "<" + PAGE_TWO_URL + ">; rel=\"next\"");
    fixture
        .server
        .expect(requestTo(PULLS_URL))
        .andRespond(withSuccess(pullsJson(1), MediaType.APPLICATION_JSON).headers(headers));

    final List<GitHubPullRequestResponse> pulls =
        fixture.client.listOpenPullRequests("ghp_token", FRONTEND);

    fixture.server.verify();
    assertThat(pulls).hasSize(1);
  }

  @Test
  void mapsUnauthorizedStatus() {
    final ClientFixture fixture = newFixture(10);
    fixture.server.expect(requestTo(PULLS_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertReason(fixture, GitHubIntegrationException.Reason.UNAUTHORIZED);
  }

  @Test
  void mapsExhaustedRateLimitToRateLimited() {
    final ClientFixture fixture = newFixture(10);
    final HttpHeaders headers = new HttpHeaders();
    headers.add("X-RateLimit-Remaining", "0");
    fixture
        .server
        .expect(requestTo(PULLS_URL))
        .andRespond(withStatus(HttpStatus.FORBIDDEN).headers(headers));

    assertReason(fixture, GitHubIntegrationException.Reason.RATE_LIMITED);
  }

  @Test
  void mapsNotFoundStatus() {
    final ClientFixture fixture = newFixture(10);
    fixture.server.expect(requestTo(PULLS_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertReason(fixture, GitHubIntegrationException.Reason.NOT_FOUND);
  }

  @Test
  void maps5xxToBadGateway() {
    final ClientFixture fixture = newFixture(10);
    fixture.server.expect(requestTo(PULLS_URL)).andRespond(withServerError());

    assertReason(fixture, GitHubIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void mapsTimeoutToTimeout() {
    final ClientFixture fixture = newFixture(10);
    fixture
        .server
        .expect(requestTo(PULLS_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertReason(fixture, GitHubIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void mapsConnectionFailureToBadGateway() {
    final ClientFixture fixture = newFixture(10);
    fixture
        .server
        .expect(requestTo(PULLS_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertReason(fixture, GitHubIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void mapsMalformedBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture(10);
    fixture
        .server
        .expect(requestTo(PULLS_URL))
        .andRespond(withSuccess("{\"message\":\"not a list\"}", MediaType.APPLICATION_JSON));

    assertReason(fixture, GitHubIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void listCheckRunsReadsRuns() {
    final ClientFixture fixture = newFixture(10);
    fixture
        .server
        .expect(
            requestTo(
                "http://github.test/repos/myorg/frontend/commits/abc123/check-runs?per_page=100"))
        .andExpect(header("Authorization", "Bearer ghp_token"))
        .andRespond(
            withSuccess(
                """
                {"total_count":2,"check_runs":[
                {"name":"build","status":"completed","conclusion":"success"},
                {"name":"lint","status":"in_progress","conclusion":null}]}
                """,
                MediaType.APPLICATION_JSON));

    final List<GitHubCheckRunResponse> runs =
        fixture.client.listCheckRuns("ghp_token", FRONTEND, "abc123");

    assertThat(runs)
        .containsExactly(
            new GitHubCheckRunResponse("build", "completed", "success"),
            new GitHubCheckRunResponse("lint", "in_progress", null));
  }

  @Test
  void nullListEntriesAreDropped() {
    final ClientFixture fixture = newFixture(10);
    fixture
        .server
        .expect(requestTo(PULLS_URL))
        .andRespond(
            withSuccess(
                """
                [{"number":3,"title":"PR 3","labels":[null,{"name":"bug"}],
                  "head":{"sha":"sha3"},"html_url":"https://github.com/myorg/frontend/pull/3"}]
                """,
                MediaType.APPLICATION_JSON));
    fixture
        .server
        .expect(
            requestTo(
                "http://github.test/repos/myorg/frontend/commits/sha3/check-runs?per_page=100"))
        .andRespond(
            withSuccess(
                """
                {"total_count":2,"check_runs":[null,
                {"name":"build","status":"completed","conclusion":"failure"}]}
                """,
                MediaType.APPLICATION_JSON));

    final List<GitHubPullRequestResponse> pulls =
        fixture.client.listOpenPullRequests("ghp_token", FRONTEND);
    final List<GitHubCheckRunResponse> runs =
        fixture.client.listCheckRuns("ghp_token", FRONTEND, "sha3");

    assertThat(pulls).singleElement().satisfies(
        pull -> assertThat(pull.labels()).extracting(GitHubLabelResponse::name)
            .containsExactly("bug"));
    assertThat(runs).containsExactly(new GitHubCheckRunResponse("build", "completed", "failure"));
  }

  @Test
  void nextPageUriIgnoresOtherRelations() {
    final HttpHeaders headers = new HttpHeaders();
    headers.add(
        HttpHeaders.LINK,
        "<https://api.github.com/x?page=1>; rel=\"prev\", <https://api.github.com/x?page=3>; rel=\"next\"");

    assertThat(GitHubClient.nextPageUri(headers))
        .isEqualTo(URI.create("https://api.github.com/x?page=3"));
    assertThat(GitHubClient.nextPageUri(new HttpHeaders())).isNull();
  }

  private void assertReason(ClientFixture fixture, GitHubIntegrationException.Reason reason) {
    assertThatThrownBy(() -> fixture.client.listOpenPullRequests("ghp_token", FRONTEND))
        .isInstanceOf(GitHubIntegrationException.class)
        .extracting(ex -> ((GitHubIntegrationException) ex).reason())
        .isEqualTo(reason);
  }

  private static String pullsJson(int... numbers) {
    final StringBuilder json = new StringBuilder("[");
    for (int i = 0; i < numbers.length; i++) {
      final int number = numbers[i];
      if (i > 0) {
        json.append(',');
      }
      json.append(
          """
          {"number":%d,"title":"PR %d","state":"open",
           "user":{"login":"alice","avatar_url":"https://avatars.example.com/alice"},
           "labels":[{"id":1,"name":"bug"}],
           "head":{"sha":"sha%d","ref":"feature"},
           "html_url":"https://github.com/myorg/frontend/pull/%d",
           "created_at":"2026-03-01T10:00:00Z"}
          """
              .formatted(number, number, number, number));
    }
    return json.append(']').toString();
  }

  private ClientFixture newFixture(int maxPages) {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://github.test").build();
    final GitHubClientProperties properties =
        new GitHubClientProperties("http://github.test", 100, maxPages, null, null, 0);
    return new ClientFixture(new GitHubClient(restClient, properties), server);
  }

  private record ClientFixture(GitHubClient client, MockRestServiceServer server) {}
}
