/*
 * Where: scheduler configuration tests
 * What: binds scheduler/github/notification.email properties from strings and checks defaults
 * Why: Duration strings and defaulted fields must survive the move between environments
 */
package com.example.scheduler.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class SchedulerPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "security.encryption-key=q5Ybkw_yPhtMLKfOOGAfQ688uTD1tgKLzvtxBgpbmqs=");

  @Test
  void bindsDurationsAndZone() {
    contextRunner
        .withPropertyValues(
            "scheduler.timezone=Asia/Tokyo",
            "scheduler.executor-pool-size=4",
            "scheduler.misfire-grace-time=30s",
            "scheduler.shutdown-timeout=2m",
            "scheduler.sync.enabled=false",
            "scheduler.sync.poll-interval=15s",
            "github.base-url=https://github.example.com/api/v3",
            "github.max-pages=3",
            "github.read-timeout=45s",
            "notification.email.smtp-enabled=true",
            "notification.email.application-url=https://pr-review.example.com/")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final SchedulerProperties scheduler = context.getBean(SchedulerProperties.class);
              final GitHubClientProperties github = context.getBean(GitHubClientProperties.class);
              final NotificationEmailProperties email =
                  context.getBean(NotificationEmailProperties.class);

              assertThat(scheduler.zoneId()).isEqualTo(ZoneId.of("Asia/Tokyo"));
              assertThat(scheduler.executorPoolSize()).isEqualTo(4);
              assertThat(scheduler.misfireGraceTime()).isEqualTo(Duration.ofSeconds(30));
              assertThat(scheduler.shutdownTimeout()).isEqualTo(Duration.ofMinutes(2));
              assertThat(scheduler.sync().enabled()).isFalse();
              assertThat(scheduler.sync().pollInterval()).isEqualTo(Duration.ofSeconds(15));
              assertThat(github.baseUrl()).isEqualTo("https://github.example.com/api/v3");
              assertThat(github.maxPages()).isEqualTo(3);
              assertThat(github.readTimeout()).isEqualTo(Duration.ofSeconds(45));
              assertThat(email.smtpEnabled()).isTrue();
              assertThat(email.applicationUrl()).isEqualTo("https://pr-review.example.com");
            });
  }

  @Test
  void appliesDefaultsWhenUnset() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final SchedulerProperties scheduler = context.getBean(SchedulerProperties.class);
          final GitHubClientProperties github = context.getBean(GitHubClientProperties.class);
          final NotificationEmailProperties email =
              context.getBean(NotificationEmailProperties.class);

          assertThat(scheduler.timezone()).isEqualTo("UTC");
          assertThat(scheduler.executorPoolSize()).isEqualTo(10);
          assertThat(scheduler.misfireGraceTime()).isEqualTo(Duration.ofSeconds(60));
          assertThat(scheduler.sync().pollInterval()).isEqualTo(Duration.ofSeconds(60));
          assertThat(github.baseUrl()).isEqualTo("https://api.github.com");
          assertThat(github.pageSize()).isEqualTo(100);
          assertThat(github.maxPages()).isEqualTo(10);
          assertThat(github.connectTimeout()).isEqualTo(Duration.ofSeconds(5));
          assertThat(github.readTimeout()).isEqualTo(Duration.ofSeconds(20));
          assertThat(github.fetchConcurrency()).isEqualTo(8);
          assertThat(email.smtpEnabled()).isFalse();
          assertThat(email.applicationUrl()).isEqualTo("http://localhost:5173");
          assertThat(email.subject()).isEqualTo("[PR-Review] Open Pull Requests Summary");
        });
  }

  @Test
  void failsOnUnknownTimezone() {
    contextRunner
        .withPropertyValues("scheduler.timezone=Mars/Olympus")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void failsOnBlankEncryptionKey() {
    contextRunner
        .withPropertyValues("security.encryption-key= ")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    SchedulerProperties.class,
    GitHubClientProperties.class,
    NotificationEmailProperties.class,
    EncryptionProperties.class
  })
  static class TestConfiguration {}
}
