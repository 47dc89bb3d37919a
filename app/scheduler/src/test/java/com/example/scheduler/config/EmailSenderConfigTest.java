package com.example.scheduler.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.example.scheduler.service.EmailSender;
import com.example.scheduler.service.LocalEmailSender;
import com.example.scheduler.service.SmtpEmailSender;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.mail.javamail.JavaMailSender;

class EmailSenderConfigTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void usesLocalSenderByDefault() {
    contextRunner.run(
        context ->
            assertThat(context.getBean(EmailSender.class)).isInstanceOf(LocalEmailSender.class));
  }

  @Test
  void usesSmtpSenderWhenEnabled() {
    contextRunner
        .withPropertyValues("notification.email.smtp-enabled=true")
        .run(
            context -> {
              assertThat(context).hasSingleBean(EmailSender.class);
              assertThat(context.getBean(EmailSender.class)).isInstanceOf(SmtpEmailSender.class);
            });
  }

  @Configuration
  @EnableConfigurationProperties(NotificationEmailProperties.class)
  @Import(EmailSenderConfig.class)
  static class TestConfiguration {

    @Bean
    JavaMailSender javaMailSender() {
      return mock(JavaMailSender.class);
    }
  }
}
