/*
 * Where: scheduler service layer
 * What: renders the open pull request summary email
 * Why: the wording and links are shared with the web UI's notification settings page
 */
package com.example.scheduler.service;

import com.example.scheduler.config.NotificationEmailProperties;
import java.util.Map;
import java.util.StringJoiner;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PullRequestSummaryFormatter {

  private final NotificationEmailProperties properties;

  /**
   * @param countsByRepository open pull request count keyed by {@code organization/repository}, in
   *     display order
   */
  public EmailMessage format(Map<String, Integer> countsByRepository) {
    final String applicationUrl = properties.applicationUrl();
    final StringJoiner body = new StringJoiner("\n");
    body.add("You have open pull requests that need attention.");
    body.add("");
    body.add("Repository Summary:");
    countsByRepository.forEach(
        (repository, count) ->
            body.add("- " + repository + ": " + count + " open PR" + (count == 1 ? "" : "s")));
    body.add("");
    body.add("View details: " + applicationUrl + "/");
    body.add("");
    body.add("---");
    body.add("This is an automated message from PR-Review.");
    body.add("To manage your notification settings, visit " + applicationUrl + "/settings");
    return new EmailMessage(properties.subject(), body.toString());
  }
}
