package com.example.scheduler.service;

public record EmailMessage(String subject, String body) {}
