package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void convertsInstantToTimestampAndBack() {
    final Instant instant = Instant.parse("2026-03-02T09:00:00.123Z");

    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(instant);

    assertThat(timestamp.getTime()).isEqualTo(instant.toEpochMilli());
    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(instant);
  }

  @Test
  void nullStaysNull() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }

  @Test
  void runIdsAreShortAndDistinct() {
    final String first = RunIds.newRunId();
    final String second = RunIds.newRunId();

    assertThat(first).hasSize(8).isNotEqualTo(second);
    assertThat(RunIds.newId()).hasSize(36);
  }
}
