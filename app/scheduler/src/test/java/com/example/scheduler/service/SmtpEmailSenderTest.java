package com.example.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.example.scheduler.config.NotificationEmailProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

@ExtendWith(MockitoExtension.class)
class SmtpEmailSenderTest {

  @Mock private JavaMailSender javaMailSender;

  private SmtpEmailSender newSender() {
    return new SmtpEmailSender(
        javaMailSender,
        new NotificationEmailProperties(true, "noreply@example.com", null, null));
  }

  @Test
  void sendsPlainTextMessage() {
    final boolean sent = newSender().send("dev@example.com", "subject", "body");

    final ArgumentCaptor<SimpleMailMessage> captor =
        ArgumentCaptor.forClass(SimpleMailMessage.class);
    verify(javaMailSender).send(captor.capture());
    assertThat(sent).isTrue();
    assertThat(captor.getValue().getFrom()).isEqualTo("noreply@example.com");
    assertThat(captor.getValue().getTo()).containsExactly("dev@example.com");
    assertThat(captor.getValue().getSubject()).isEqualTo("subject");
    assertThat(captor.getValue().getText()).isEqualTo("body");
  }

  @Test
  void returnsFalseWhenSmtpFails() {
    doThrow(new MailSendException("connection refused"))
        .when(javaMailSender)
        .send(any(SimpleMailMessage.class));

    assertThat(newSender().send("dev@example.com", "subject", "body")).isFalse();
  }

  @Test
  void returnsFalseForBlankRecipient() {
    assertThat(newSender().send(" ", "subject", "body")).isFalse();
    verifyNoInteractions(javaMailSender);
  }
}
