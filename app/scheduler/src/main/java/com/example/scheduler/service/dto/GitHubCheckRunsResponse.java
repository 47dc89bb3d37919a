package com.example.scheduler.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GitHubCheckRunsResponse(Integer totalCount, List<GitHubCheckRunResponse> checkRuns) {

  public GitHubCheckRunsResponse {
    checkRuns =
        checkRuns == null ? List.of() : checkRuns.stream().filter(Objects::nonNull).toList();
  }
}
