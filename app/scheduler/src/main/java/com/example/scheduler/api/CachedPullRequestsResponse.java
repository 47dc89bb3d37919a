package com.example.scheduler.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CachedPullRequestsResponse(String scheduleId, List<CachedPullRequestSummary> items) {

  public CachedPullRequestsResponse {
    items = items == null ? List.of() : List.copyOf(items);
  }
}
