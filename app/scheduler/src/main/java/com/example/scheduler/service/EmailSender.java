package com.example.scheduler.service;

/** Sends a plain-text email. Implementations report failure through the return value and never throw. */
public interface EmailSender {

  boolean send(String toAddress, String subject, String body);
}
