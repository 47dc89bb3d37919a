/*
 * Where: scheduler service layer
 * What: read access to notification schedules and write access to the cached pull request snapshot
 * Why: the reconciler and job executor are tested against this seam without a database
 */
package com.example.scheduler.service;

import com.example.scheduler.model.CachedPullRequest;
import com.example.scheduler.model.NotificationSchedule;
import com.example.scheduler.model.OpenPullRequest;
import java.util.List;
import java.util.Optional;

public interface ScheduleStore {

  /** Active schedules with decrypted tokens; a schedule whose token cannot be decrypted is left out. */
  List<NotificationSchedule> listActiveSchedules();

  /** Ids of every schedule, active or not. */
  List<String> listAllScheduleIds();

  Optional<NotificationSchedule> getScheduleById(String scheduleId);

  /** Atomically replaces the schedule's snapshot with exactly {@code pullRequests}. */
  void replaceCachedPullRequests(String scheduleId, List<OpenPullRequest> pullRequests);

  List<CachedPullRequest> findCachedPullRequests(String scheduleId);
}
