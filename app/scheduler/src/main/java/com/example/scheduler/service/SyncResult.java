package com.example.scheduler.service;

public record SyncResult(int upserted, int removed, int failed) {

  public boolean hasFailures() {
    return failed > 0;
  }
}
