/*
 * Where: scheduler scheduling layer
 * What: parses standard 5-field crontab expressions into Spring CronExpression
 * Why: schedules are stored as "minute hour day-of-month month day-of-week" while Spring expects seconds
 */
package com.example.scheduler.scheduling;

import org.springframework.scheduling.support.CronExpression;

public final class CronExpressions {

  private static final int STANDARD_FIELD_COUNT = 5;

  private CronExpressions() {}

  public static CronExpression parseStandard(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new InvalidCronExpressionException(expression, "expression is blank");
    }
    final String[] fields = expression.trim().split("\\s+");
    if (fields.length != STANDARD_FIELD_COUNT) {
      throw new InvalidCronExpressionException(
          expression, "expected 5 fields but got " + fields.length);
    }
    try {
      // seconds pinned to 0
      return CronExpression.parse("0 " + String.join(" ", fields));
    } catch (IllegalArgumentException ex) {
      throw new InvalidCronExpressionException(expression, ex.getMessage(), ex);
    }
  }
}
