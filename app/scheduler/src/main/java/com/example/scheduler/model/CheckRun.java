package com.example.scheduler.model;

/** One CI check run on a commit. {@code conclusion} is null until the run completes. */
public record CheckRun(String status, String conclusion) {}
