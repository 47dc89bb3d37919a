package com.example.scheduler.scheduling;

public class InvalidCronExpressionException extends RuntimeException {

  private final String expression;

  public InvalidCronExpressionException(String expression, String message) {
    super(describe(expression, message));
    this.expression = expression;
  }

  public InvalidCronExpressionException(String expression, String message, Throwable cause) {
    super(describe(expression, message), cause);
    this.expression = expression;
  }

  public String expression() {
    return expression;
  }

  private static String describe(String expression, String message) {
    return "invalid cron expression '" + expression + "': " + message;
  }
}
