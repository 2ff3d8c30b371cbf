/*
 * Where: Notification admin API
 * What: Read-only views over the send ledger
 * Why: Delivery failures are only visible through the ledger and logs
 */
package com.safetyops.notification.api;

import com.safetyops.notification.model.LedgerStats;
import com.safetyops.notification.model.SendLedgerEntry;
import com.safetyops.notification.service.SendLedgerService;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/ledger")
@RequiredArgsConstructor
public class SendLedgerController {

  private static final int MAX_HISTORY = 500;

  private final SendLedgerService ledgerService;

  @GetMapping("/stats")
  public LedgerStats stats(
      @RequestParam(value = "from", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(value = "to", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to) {
    if (from != null && to != null && from.isAfter(to)) {
      throw new IllegalArgumentException("from must not be after to");
    }
    return ledgerService.summarize(from, to);
  }

  @GetMapping("/recipients/{recipientId}")
  public List<SendLedgerEntry> history(
      @PathVariable("recipientId") String recipientId,
      @RequestParam(value = "limit", defaultValue = "50") int limit) {
    if (limit < 1 || limit > MAX_HISTORY) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_HISTORY);
    }
    return ledgerService.history(recipientId, limit);
  }
}
