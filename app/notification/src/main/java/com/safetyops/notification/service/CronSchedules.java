/*
 * Where: Notification service layer
 * What: Parses standard 5-field cron expressions into Spring cron expressions
 * Why: Schedules are stored as "minute hour day-of-month month day-of-week"; Spring wants seconds too
 */
package com.safetyops.notification.service;

import org.springframework.scheduling.support.CronExpression;

public final class CronSchedules {

  private static final int STANDARD_FIELD_COUNT = 5;

  private CronSchedules() {}

  /**
   * @throws IllegalArgumentException when the expression is blank, not 5 fields, or invalid
   */
  public static CronExpression parse(String expression) {
    return CronExpression.parse(toSpringExpression(expression));
  }

  /** Prepends a zero seconds field to a validated 5-field expression. */
  public static String toSpringExpression(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new IllegalArgumentException("cron expression is blank");
    }
    final String trimmed = expression.trim();
    final int fields = trimmed.split("\\s+").length;
    if (fields != STANDARD_FIELD_COUNT) {
      throw new IllegalArgumentException(
          "cron expression must have 5 fields but had " + fields + ": " + expression);
    }
    return "0 " + trimmed;
  }
}
