/*
 * Where: Notification domain model
 * What: Outcome of a single sendByType call
 * Why: Callers branch on status without catching transport exceptions
 */
package com.safetyops.notification.model;

public record DispatchResult(SendStatus status, String messageId, String error) {

  public static DispatchResult sent(String messageId) {
    return new DispatchResult(SendStatus.SENT, messageId, null);
  }

  public static DispatchResult failed(String error) {
    return new DispatchResult(SendStatus.FAILED, null, error);
  }

  public boolean succeeded() {
    return status == SendStatus.SENT;
  }
}
