/*
 * Where: scheduler configuration binding
 * What: holds the cron scheduler and schedule sync settings
 * Why: pool size, timezone and grace periods differ per environment
 */
package com.example.scheduler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "scheduler")
@Validated
public record SchedulerProperties(
    @NotBlank String timezone,
    @Positive int executorPoolSize,
    @NotNull Duration misfireGraceTime,
    @NotNull Duration shutdownTimeout,
    @NotNull @Valid Sync sync) {

  public SchedulerProperties {
    timezone = timezone == null || timezone.isBlank() ? "UTC" : timezone;
    executorPoolSize = executorPoolSize == 0 ? 10 : executorPoolSize;
    misfireGraceTime = misfireGraceTime == null ? Duration.ofSeconds(60) : misfireGraceTime;
    shutdownTimeout = shutdownTimeout == null ? Duration.ofSeconds(60) : shutdownTimeout;
    sync = sync == null ? new Sync(true, null) : sync;
  }

  public ZoneId zoneId() {
    return ZoneId.of(timezone);
  }

  @AssertTrue(message = "scheduler.timezone must be a valid zone id")
  public boolean isTimezoneValid() {
    try {
      ZoneId.of(timezone);
      return true;
    } catch (DateTimeException ex) {
      return false;
    }
  }

  @AssertTrue(message = "scheduler.misfire-grace-time must not be negative")
  public boolean isMisfireGraceTimeValid() {
    return misfireGraceTime != null && !misfireGraceTime.isNegative();
  }

  @AssertTrue(message = "scheduler.shutdown-timeout must not be negative")
  public boolean isShutdownTimeoutValid() {
    return shutdownTimeout != null && !shutdownTimeout.isNegative();
  }

  public record Sync(boolean enabled, Duration pollInterval) {

    public Sync {
      pollInterval = pollInterval == null ? Duration.ofSeconds(60) : pollInterval;
    }

    @AssertTrue(message = "scheduler.sync.poll-interval must be positive")
    public boolean isPollIntervalPositive() {
      return pollInterval != null && !pollInterval.isZero() && !pollInterval.isNegative();
    }
  }
}
