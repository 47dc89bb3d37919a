package com.example.common;

import java.util.UUID;

public final class RunIds {
  private static final int SHORT_LENGTH = 8;

  private RunIds() {}

  public static String newRunId() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, SHORT_LENGTH);
  }

  public static String newId() {
    return UUID.randomUUID().toString();
  }
}
