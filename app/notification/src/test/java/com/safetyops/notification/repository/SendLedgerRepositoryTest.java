/*
 * Where: Notification send ledger repository integration test
 * What: Verifies window boundaries, history ordering and aggregate counts on Postgres
 * Why: Dedup correctness depends on the half-open window being evaluated by the database
 */
package com.safetyops.notification.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.safetyops.notification.AbstractPostgresContainerTest;
import com.safetyops.notification.model.NotificationKind;
import com.safetyops.notification.model.SendLedgerEntry;
import com.safetyops.notification.model.SendStatus;
import com.safetyops.notification.repository.SendLedgerRepository.KindStatusCount;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class SendLedgerRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2024-06-10T00:00:00Z");
  private static final Duration WINDOW = Duration.ofHours(24);

  @Autowired private SendLedgerRepository ledgerRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM send_ledger", new MapSqlParameterSource());
  }

  @Test
  void rowJustInsideWindowIsFound() {
    ledgerRepository.insert(
        sent(NotificationKind.TBM_REMINDER, "u1", NOW.minus(WINDOW).plus(minutes(1))));

    assertThat(
            ledgerRepository.existsBetween(
                NotificationKind.TBM_REMINDER, "u1", NOW.minus(WINDOW), NOW))
        .isTrue();
  }

  @Test
  void rowJustOutsideWindowIsNotFound() {
    ledgerRepository.insert(
        sent(NotificationKind.TBM_REMINDER, "u1", NOW.minus(WINDOW).minus(minutes(1))));

    assertThat(
            ledgerRepository.existsBetween(
                NotificationKind.TBM_REMINDER, "u1", NOW.minus(WINDOW), NOW))
        .isFalse();
  }

  @Test
  void windowExcludesLowerBoundAndIncludesUpperBound() {
    ledgerRepository.insert(sent(NotificationKind.TBM_REMINDER, "u1", NOW.minus(WINDOW)));
    ledgerRepository.insert(sent(NotificationKind.TBM_REMINDER, "u2", NOW));

    assertThat(
            ledgerRepository.existsBetween(
                NotificationKind.TBM_REMINDER, "u1", NOW.minus(WINDOW), NOW))
        .isFalse();
    assertThat(
            ledgerRepository.existsBetween(
                NotificationKind.TBM_REMINDER, "u2", NOW.minus(WINDOW), NOW))
        .isTrue();
  }

  @Test
  void windowIsScopedToKindAndRecipient() {
    ledgerRepository.insert(sent(NotificationKind.TBM_REMINDER, "u1", NOW.minus(minutes(5))));

    assertThat(
            ledgerRepository.existsBetween(
                NotificationKind.EDUCATION_REMINDER, "u1", NOW.minus(WINDOW), NOW))
        .isFalse();
    assertThat(
            ledgerRepository.existsBetween(
                NotificationKind.TBM_REMINDER, "u2", NOW.minus(WINDOW), NOW))
        .isFalse();
  }

  @Test
  void historyIsNewestFirstAndLimited() {
    ledgerRepository.insert(sent(NotificationKind.TBM_REMINDER, "u1", NOW.minus(minutes(30))));
    ledgerRepository.insert(
        SendLedgerEntry.failed(
            NotificationKind.NOTICE_PUBLISHED,
            "u1",
            "u1@x.com",
            "",
            "template disabled",
            NOW.minus(minutes(10))));
    ledgerRepository.insert(sent(NotificationKind.TBM_REMINDER, "u1", NOW.minus(minutes(60))));
    ledgerRepository.insert(sent(NotificationKind.TBM_REMINDER, "u2", NOW));

    final List<SendLedgerEntry> history = ledgerRepository.findByRecipientId("u1", 2);

    assertThat(history)
        .extracting(SendLedgerEntry::sentAt)
        .containsExactly(NOW.minus(minutes(10)), NOW.minus(minutes(30)));
    assertThat(history.get(0).status()).isEqualTo(SendStatus.FAILED);
    assertThat(history.get(0).errorMessage()).isEqualTo("template disabled");
    assertThat(history.get(0).subject()).isEmpty();
  }

  @Test
  void countsAreGroupedAndRangeBoundsAreInclusive() {
    ledgerRepository.insert(sent(NotificationKind.TBM_REMINDER, "u1", NOW.minus(minutes(120))));
    ledgerRepository.insert(sent(NotificationKind.TBM_REMINDER, "u2", NOW.minus(minutes(60))));
    ledgerRepository.insert(
        SendLedgerEntry.failed(
            NotificationKind.TBM_REMINDER, "u3", "u3@x.com", "s", "timeout", NOW));

    assertThat(ledgerRepository.countByKindAndStatus(null, null))
        .containsExactly(
            new KindStatusCount(NotificationKind.TBM_REMINDER, SendStatus.FAILED, 1),
            new KindStatusCount(NotificationKind.TBM_REMINDER, SendStatus.SENT, 2));
    assertThat(ledgerRepository.countByKindAndStatus(NOW.minus(minutes(60)), NOW))
        .containsExactly(
            new KindStatusCount(NotificationKind.TBM_REMINDER, SendStatus.FAILED, 1),
            new KindStatusCount(NotificationKind.TBM_REMINDER, SendStatus.SENT, 1));
  }

  private static SendLedgerEntry sent(NotificationKind kind, String recipientId, Instant at) {
    return SendLedgerEntry.sent(kind, recipientId, recipientId + "@x.com", "subject", at);
  }

  private static Duration minutes(long minutes) {
    return Duration.ofMinutes(minutes);
  }
}
