/*
 * Where: Notification domain model
 * What: Closed set of notification kinds and their dispatch policy
 * Why: Templates, schedules and ledger rows are keyed by kind; adding one is a table change
 */
package com.safetyops.notification.model;

import java.util.Locale;

public enum NotificationKind {
  EDUCATION_REMINDER(true, true),
  TBM_REMINDER(true, true),
  SAFETY_INSPECTION_REMINDER(true, true),
  EXEC_SIGNATURE_REQUEST(false, false),
  EXEC_SIGNATURE_COMPLETE(false, false),
  NOTICE_PUBLISHED(false, false);

  private final boolean schedulable;
  private final boolean deduplicated;

  NotificationKind(boolean schedulable, boolean deduplicated) {
    this.schedulable = schedulable;
    this.deduplicated = deduplicated;
  }

  /** Whether a cron tick may resolve recipients for this kind on its own. */
  public boolean schedulable() {
    return schedulable;
  }

  /** Whether batch dispatch suppresses repeats to the same recipient inside the dedup window. */
  public boolean deduplicated() {
    return deduplicated;
  }

  public static NotificationKind fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("notification kind is blank");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown notification kind: " + value, ex);
    }
  }
}
