/*
 * Where: common logging helpers
 * What: puts MDC keys for the length of a try-with-resources block and carries them to other threads
 * Why: job runs and their fan-out tasks must log with the same schedule_id/run_id keys
 */
package com.example.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.MDC;

public final class MdcScope implements AutoCloseable {

  private final List<String> keys;

  private MdcScope(List<String> keys) {
    this.keys = keys;
  }

  public static MdcScope open(Map<String, String> values) {
    final List<String> keys = new ArrayList<>();
    values.forEach(
        (key, value) -> {
          if (value == null || value.isBlank()) {
            return;
          }
          MDC.put(key, value);
          keys.add(key);
        });
    return new MdcScope(Collections.unmodifiableList(keys));
  }

  public static MdcScope open(String key, String value) {
    final Map<String, String> values = new LinkedHashMap<>();
    values.put(key, value);
    return open(values);
  }

  /** Wraps a task so that it runs with the caller's MDC context on whatever thread executes it. */
  public static <T> Supplier<T> wrap(Supplier<T> task) {
    final Map<String, String> captured = MDC.getCopyOfContextMap();
    return () -> {
      final Map<String, String> previous = MDC.getCopyOfContextMap();
      if (captured == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(captured);
      }
      try {
        return task.get();
      } finally {
        if (previous == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(previous);
        }
      }
    };
  }

  public List<String> keys() {
    return keys;
  }

  @Override
  public void close() {
    for (String key : keys) {
      MDC.remove(key);
    }
  }
}
