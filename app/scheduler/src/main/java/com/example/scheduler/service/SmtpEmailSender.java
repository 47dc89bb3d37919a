/*
 * Where: scheduler service layer
 * What: sends summary emails through Spring's JavaMailSender
 * Why: an unreachable SMTP server must not abort the notification run
 */
package com.example.scheduler.service;

import com.example.scheduler.config.NotificationEmailProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

public class SmtpEmailSender implements EmailSender {

  private static final Logger logger = LoggerFactory.getLogger(SmtpEmailSender.class);

  private final JavaMailSender javaMailSender;
  private final NotificationEmailProperties properties;

  public SmtpEmailSender(JavaMailSender javaMailSender, NotificationEmailProperties properties) {
    this.javaMailSender = javaMailSender;
    this.properties = properties;
  }

  @Override
  public boolean send(String toAddress, String subject, String body) {
    if (toAddress == null || toAddress.isBlank()) {
      logger.warn("email not sent because the recipient is empty subject='{}'", subject);
      return false;
    }
    final SimpleMailMessage message = new SimpleMailMessage();
    message.setFrom(properties.fromAddress());
    message.setTo(toAddress);
    message.setSubject(subject);
    message.setText(body);
    try {
      javaMailSender.send(message);
      logger.info("email sent to={} subject='{}'", toAddress, subject);
      return true;
    } catch (MailException ex) {
      logger.error("failed to send email to={} subject='{}'", toAddress, subject, ex);
      return false;
    } catch (RuntimeException ex) {
      logger.error("unexpected error sending email to={}", toAddress, ex);
      return false;
    }
  }
}
