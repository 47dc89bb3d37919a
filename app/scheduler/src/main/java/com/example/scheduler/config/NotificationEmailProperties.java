/*
 * Where: scheduler configuration binding
 * What: holds the summary email sender address, subject and web application URL
 * Why: the links in the email must point at the environment's web UI
 */
package com.example.scheduler.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.email")
@Validated
public record NotificationEmailProperties(
    boolean smtpEnabled,
    @NotBlank String fromAddress,
    @NotBlank String applicationUrl,
    @NotBlank String subject) {

  public NotificationEmailProperties {
    fromAddress =
        fromAddress == null || fromAddress.isBlank() ? "noreply@pr-review.local" : fromAddress;
    applicationUrl =
        applicationUrl == null || applicationUrl.isBlank()
            ? "http://localhost:5173"
            : stripTrailingSlash(applicationUrl.trim());
    subject =
        subject == null || subject.isBlank() ? "[PR-Review] Open Pull Requests Summary" : subject;
  }

  private static String stripTrailingSlash(String url) {
    String result = url;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
