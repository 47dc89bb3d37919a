/*
 * Where: scheduler domain model
 * What: an active notification schedule with its decrypted token and target repositories
 * Why: the job executor needs everything for one run in a single value
 */
package com.example.scheduler.model;

import java.util.List;

public record NotificationSchedule(
    String id,
    String userId,
    String name,
    String cronExpression,
    String githubPat,
    boolean active,
    String notificationEmail,
    List<RepositoryRef> repositories) {

  public NotificationSchedule {
    repositories = repositories == null ? List.of() : List.copyOf(repositories);
  }

  public boolean hasNotificationEmail() {
    return notificationEmail != null && !notificationEmail.isBlank();
  }

  @Override
  public String toString() {
    return "NotificationSchedule[id="
        + id
        + ", userId="
        + userId
        + ", name="
        + name
        + ", cronExpression="
        + cronExpression
        + ", githubPat=***, active="
        + active
        + ", repositories="
        + repositories
        + "]";
  }
}
