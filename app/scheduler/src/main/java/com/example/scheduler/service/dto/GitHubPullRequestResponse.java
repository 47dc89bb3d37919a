package com.example.scheduler.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GitHubPullRequestResponse(
    int number,
    String title,
    GitHubUserResponse user,
    List<GitHubLabelResponse> labels,
    GitHubHeadResponse head,
    String htmlUrl,
    String createdAt) {

  public GitHubPullRequestResponse {
    labels = labels == null ? List.of() : labels.stream().filter(Objects::nonNull).toList();
  }

  public String headSha() {
    return head == null ? null : head.sha();
  }
}
