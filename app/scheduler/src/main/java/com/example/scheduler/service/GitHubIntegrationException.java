/*
 * Where: scheduler service layer
 * What: a failed GitHub REST call classified by reason
 * Why: callers apply one fallback policy per reason instead of inspecting HTTP details
 */
package com.example.scheduler.service;

public class GitHubIntegrationException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    UNAUTHORIZED,
    RATE_LIMITED,
    TIMEOUT,
    BAD_GATEWAY,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public GitHubIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public GitHubIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
