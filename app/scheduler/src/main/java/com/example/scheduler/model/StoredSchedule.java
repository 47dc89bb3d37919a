package com.example.scheduler.model;

/** A notification_schedules row joined with its owner's email; the token is still encrypted. */
public record StoredSchedule(
    String id,
    String userId,
    String name,
    String cronExpression,
    String encryptedPat,
    boolean active,
    String userEmail) {

  @Override
  public String toString() {
    return "StoredSchedule[id=" + id + ", userId=" + userId + ", active=" + active + "]";
  }
}
