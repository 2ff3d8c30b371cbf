/*
 * Where: Notification domain model
 * What: Outcome recorded for one send attempt
 * Why: Keeps the ledger's status column and the dispatch result in one vocabulary
 */
package com.safetyops.notification.model;

public enum SendStatus {
  SENT("sent"),
  FAILED("failed");

  private final String value;

  SendStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static SendStatus fromValue(String value) {
    for (SendStatus status : values()) {
      if (status.value.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown send status: " + value);
  }
}
