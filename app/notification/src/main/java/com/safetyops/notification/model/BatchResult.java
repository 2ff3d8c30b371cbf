/*
 * Where: Notification domain model
 * What: Per-outcome counts for one batch dispatch
 * Why: A batch is never all-or-nothing; the job logs these counts instead
 */
package com.safetyops.notification.model;

public record BatchResult(int sent, int failed, int skipped) {

  public static final BatchResult EMPTY = new BatchResult(0, 0, 0);

  public int total() {
    return sent + failed + skipped;
  }
}
