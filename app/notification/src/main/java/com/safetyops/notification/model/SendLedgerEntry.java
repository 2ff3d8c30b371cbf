/*
 * Where: Notification domain model
 * What: One append-only row of the send ledger
 * Why: Serves both as audit trail and as the only source for duplicate suppression
 */
package com.safetyops.notification.model;

import java.time.Instant;
import java.util.UUID;

public record SendLedgerEntry(
    UUID entryId,
    NotificationKind notificationKind,
    String recipientId,
    String recipientEmail,
    String subject,
    SendStatus status,
    String errorMessage,
    Instant sentAt) {

  public static SendLedgerEntry sent(
      NotificationKind kind, String recipientId, String recipientEmail, String subject, Instant at) {
    return new SendLedgerEntry(
        UUID.randomUUID(), kind, recipientId, recipientEmail, subject, SendStatus.SENT, null, at);
  }

  public static SendLedgerEntry failed(
      NotificationKind kind,
      String recipientId,
      String recipientEmail,
      String subject,
      String errorMessage,
      Instant at) {
    return new SendLedgerEntry(
        UUID.randomUUID(),
        kind,
        recipientId,
        recipientEmail,
        subject,
        SendStatus.FAILED,
        errorMessage,
        at);
  }
}
