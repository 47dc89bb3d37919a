/*
 * Where: scheduler domain model
 * What: one open pull request as fetched from GitHub with its aggregated check status
 * Why: the job caches and counts these per repository
 */
package com.example.scheduler.model;

import java.time.Instant;
import java.util.List;

public record OpenPullRequest(
    String organization,
    String repository,
    int number,
    String title,
    String author,
    String authorAvatarUrl,
    List<String> labels,
    ChecksStatus checksStatus,
    String htmlUrl,
    Instant createdAt) {

  public OpenPullRequest {
    labels = labels == null ? List.of() : List.copyOf(labels);
  }

  public String repositoryFullName() {
    return organization + "/" + repository;
  }
}
