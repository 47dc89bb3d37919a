/*
 * Where: scheduler configuration binding
 * What: holds the GitHub REST API endpoint, paging limits, timeouts and fetch concurrency
 * Why: GitHub Enterprise hosts and rate limits vary between deployments
 */
package com.example.scheduler.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "github")
@Validated
public record GitHubClientProperties(
    @NotBlank String baseUrl,
    @Positive @Max(100) int pageSize,
    @Positive int maxPages,
    Duration connectTimeout,
    Duration readTimeout,
    @Positive int fetchConcurrency) {

  public GitHubClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.github.com" : baseUrl;
    pageSize = pageSize == 0 ? 100 : pageSize;
    maxPages = maxPages == 0 ? 10 : maxPages;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(20) : readTimeout;
    fetchConcurrency = fetchConcurrency == 0 ? 8 : fetchConcurrency;
  }

  @AssertTrue(message = "github.connect-timeout and github.read-timeout must be positive")
  public boolean isTimeoutsPositive() {
    return isPositive(connectTimeout) && isPositive(readTimeout);
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
