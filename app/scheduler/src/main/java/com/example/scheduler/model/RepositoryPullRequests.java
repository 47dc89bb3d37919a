package com.example.scheduler.model;

import java.util.List;

public record RepositoryPullRequests(RepositoryRef repository, List<OpenPullRequest> pullRequests) {

  public RepositoryPullRequests {
    pullRequests = pullRequests == null ? List.of() : List.copyOf(pullRequests);
  }

  public static RepositoryPullRequests empty(RepositoryRef repository) {
    return new RepositoryPullRequests(repository, List.of());
  }
}
