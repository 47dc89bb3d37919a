/*
 * Where: scheduler debug API
 * What: maps request errors to the common error body
 * Why: a malformed cron expression is a client error, not a server failure
 */
package com.example.scheduler.api;

import com.example.scheduler.scheduling.InvalidCronExpressionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SchedulerApiExceptionHandler {

  @ExceptionHandler(InvalidCronExpressionException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidCron(InvalidCronExpressionException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("INVALID_CRON_EXPRESSION", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }
}
