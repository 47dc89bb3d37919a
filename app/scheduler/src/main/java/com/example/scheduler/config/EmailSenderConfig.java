/*
 * Where: scheduler configuration
 * What: selects the SMTP sender or the log-only sender from notification.email.smtp-enabled
 * Why: local runs and tests must not need a mail server
 */
package com.example.scheduler.config;

import com.example.scheduler.service.EmailSender;
import com.example.scheduler.service.LocalEmailSender;
import com.example.scheduler.service.SmtpEmailSender;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

@Configuration
public class EmailSenderConfig {

  @Bean
  @ConditionalOnProperty(
      prefix = "notification.email",
      name = "smtp-enabled",
      havingValue = "true")
  EmailSender smtpEmailSender(
      JavaMailSender javaMailSender, NotificationEmailProperties properties) {
    return new SmtpEmailSender(javaMailSender, properties);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "notification.email",
      name = "smtp-enabled",
      havingValue = "false",
      matchIfMissing = true)
  EmailSender localEmailSender() {
    return new LocalEmailSender();
  }
}
