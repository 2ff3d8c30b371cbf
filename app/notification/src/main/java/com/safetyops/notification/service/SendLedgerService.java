/*
 * Where: Notification service layer
 * What: Appends send attempts to the ledger and answers dedup/statistics queries
 * Why: A ledger write fault must never look like, or cause, a delivery fault
 */
package com.safetyops.notification.service;

import com.safetyops.notification.config.NotificationDispatchProperties;
import com.safetyops.notification.model.LedgerStats;
import com.safetyops.notification.model.NotificationKind;
import com.safetyops.notification.model.SendLedgerEntry;
import com.safetyops.notification.model.SendStatus;
import com.safetyops.notification.repository.SendLedgerRepository;
import com.safetyops.notification.repository.SendLedgerRepository.KindStatusCount;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SendLedgerService {

  private static final Logger logger = LoggerFactory.getLogger(SendLedgerService.class);

  private final SendLedgerRepository ledgerRepository;
  private final NotificationDispatchProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /**
   * Persists {@code entry}. Failures are logged and counted, never thrown.
   *
   * @return whether the row was written
   */
  public boolean append(SendLedgerEntry entry) {
    try {
      ledgerRepository.insert(entry);
      return true;
    } catch (RuntimeException ex) {
      metrics.recordLedgerWriteFailure();
      logger.error(
          "send ledger write failed kind={} recipientId={} status={}",
          entry.notificationKind(),
          entry.recipientId(),
          entry.status().value(),
          ex);
      return false;
    }
  }

  /** True iff the ledger holds a row for (kind, recipient) with {@code now - window < sentAt <= now}. */
  public boolean isDuplicate(NotificationKind kind, String recipientId) {
    final Instant now = Instant.now(clock);
    return ledgerRepository.existsBetween(
        kind, recipientId, now.minus(properties.dedupWindow()), now);
  }

  public List<SendLedgerEntry> history(String recipientId, int limit) {
    return ledgerRepository.findByRecipientId(recipientId, limit);
  }

  public LedgerStats summarize(Instant from, Instant to) {
    final List<KindStatusCount> counts = ledgerRepository.countByKindAndStatus(from, to);
    long sent = 0;
    long failed = 0;
    final Map<NotificationKind, Long> byKind = new EnumMap<>(NotificationKind.class);
    for (KindStatusCount count : counts) {
      if (count.status() == SendStatus.SENT) {
        sent += count.count();
      } else {
        failed += count.count();
      }
      byKind.merge(count.kind(), count.count(), Long::sum);
    }
    final long total = sent + failed;
    final int successRate = total > 0 ? (int) Math.round(sent * 100.0d / total) : 0;
    return new LedgerStats(
        total,
        sent,
        failed,
        successRate,
        byKind.entrySet().stream()
            .map(e -> new LedgerStats.KindCount(e.getKey(), e.getValue()))
            .toList());
  }
}
