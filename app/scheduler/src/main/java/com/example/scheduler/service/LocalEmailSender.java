/*
 * Where: scheduler service layer
 * What: logs summary emails instead of sending them
 * Why: local runs and tests have no SMTP server
 */
package com.example.scheduler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LocalEmailSender implements EmailSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalEmailSender.class);

  @Override
  public boolean send(String toAddress, String subject, String body) {
    logger.info("email delivery simulated to={} subject='{}'\n{}", toAddress, subject, body);
    return true;
  }
}
