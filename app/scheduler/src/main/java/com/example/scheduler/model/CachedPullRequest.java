package com.example.scheduler.model;

import java.time.Instant;

public record CachedPullRequest(
    String id,
    String scheduleId,
    String organization,
    String repository,
    int prNumber,
    String title,
    String author,
    String authorAvatarUrl,
    String labelsJson,
    ChecksStatus checksStatus,
    String htmlUrl,
    Instant createdAt,
    Instant cachedAt) {}
