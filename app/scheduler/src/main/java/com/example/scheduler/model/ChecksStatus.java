package com.example.scheduler.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ChecksStatus {
  PASS,
  FAIL,
  PENDING;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ChecksStatus fromValue(String value) {
    if (value == null) {
      return PENDING;
    }
    return ChecksStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
