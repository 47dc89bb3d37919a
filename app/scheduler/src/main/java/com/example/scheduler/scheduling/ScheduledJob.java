package com.example.scheduler.scheduling;

import java.time.Instant;

/** Read-only view of a registered job. {@code nextFireTime} is null when the cron never fires again. */
public record ScheduledJob(String jobId, String cronExpression, Instant nextFireTime) {}
