package com.example.scheduler.api;

import com.example.scheduler.model.ChecksStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CachedPullRequestSummary(
    String organization,
    String repository,
    int prNumber,
    String title,
    String author,
    String authorAvatarUrl,
    List<String> labels,
    ChecksStatus checksStatus,
    String htmlUrl,
    Instant createdAt,
    Instant cachedAt) {

  public CachedPullRequestSummary {
    labels = labels == null ? List.of() : List.copyOf(labels);
  }
}
