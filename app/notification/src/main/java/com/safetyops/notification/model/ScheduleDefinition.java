/*
 * Where: Notification domain model
 * What: Snapshot of a schedule_definitions row
 * Why: The registry reacts to these rows; it never edits them except for run timestamps
 */
package com.safetyops.notification.model;

import java.time.Instant;

/**
 * The kind column is kept as stored so that one row with an unknown kind cannot fail the read of
 * every other row. {@link #kind()} resolves it.
 */
public record ScheduleDefinition(
    String id,
    String name,
    String cronExpression,
    String notificationKind,
    String description,
    boolean enabled,
    Instant lastRun,
    Instant nextRun) {

  /**
   * @throws IllegalArgumentException when the stored kind is blank or unknown
   */
  public NotificationKind kind() {
    return NotificationKind.fromValue(notificationKind);
  }
}
