/*
 * Where: Notification domain model
 * What: Aggregated send ledger counts over an optional time range
 * Why: Operators check delivery health without reading raw ledger rows
 */
package com.safetyops.notification.model;

import java.util.List;

public record LedgerStats(
    long total, long sent, long failed, int successRate, List<KindCount> byKind) {

  public record KindCount(NotificationKind kind, long count) {}
}
