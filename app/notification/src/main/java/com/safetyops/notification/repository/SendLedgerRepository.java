/*
 * Where: Notification data access
 * What: Appends to send_ledger and answers window/aggregate queries over it
 * Why: The ledger is both the audit trail and the dedup source; rows are never updated
 */
package com.safetyops.notification.repository;

import static com.safetyops.common.JdbcTimestampUtils.toTimestamp;

import com.safetyops.notification.model.NotificationKind;
import com.safetyops.notification.model.SendLedgerEntry;
import com.safetyops.notification.model.SendStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SendLedgerRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(SendLedgerEntry entry) {
    final String sql =
        """
        INSERT INTO send_ledger (
          entry_id,
          notification_kind,
          recipient_id,
          recipient_email,
          subject,
          status,
          error_message,
          sent_at
        ) VALUES (
          :entryId,
          :kind,
          :recipientId,
          :recipientEmail,
          :subject,
          :status,
          :errorMessage,
          :sentAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("entryId", entry.entryId())
            .addValue("kind", entry.notificationKind().name())
            .addValue("recipientId", entry.recipientId())
            .addValue("recipientEmail", entry.recipientEmail())
            .addValue("subject", entry.subject())
            .addValue("status", entry.status().value())
            .addValue("errorMessage", entry.errorMessage())
            .addValue("sentAt", toTimestamp(entry.sentAt()));
    jdbcTemplate.update(sql, params);
  }

  /** Half-open window: {@code from < sent_at <= to}. */
  public boolean existsBetween(
      NotificationKind kind, String recipientId, Instant from, Instant to) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM send_ledger
          WHERE notification_kind = :kind
            AND recipient_id = :recipientId
            AND sent_at > :from
            AND sent_at <= :to
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("kind", kind.name())
            .addValue("recipientId", recipientId)
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public List<SendLedgerEntry> findByRecipientId(String recipientId, int limit) {
    final String sql =
        """
        SELECT entry_id, notification_kind, recipient_id, recipient_email, subject, status,
               error_message, sent_at
        FROM send_ledger
        WHERE recipient_id = :recipientId
        ORDER BY sent_at DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", recipientId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Counts per kind and status; {@code from}/{@code to} are inclusive and may be null. */
  public List<KindStatusCount> countByKindAndStatus(Instant from, Instant to) {
    final StringBuilder sql =
        new StringBuilder(
            """
            SELECT notification_kind, status, COUNT(*) AS cnt
            FROM send_ledger
            WHERE 1 = 1
            """);
    final MapSqlParameterSource params = new MapSqlParameterSource();
    if (from != null) {
      sql.append(" AND sent_at >= :from");
      params.addValue("from", toTimestamp(from));
    }
    if (to != null) {
      sql.append(" AND sent_at <= :to");
      params.addValue("to", toTimestamp(to));
    }
    sql.append(" GROUP BY notification_kind, status ORDER BY notification_kind, status");
    return jdbcTemplate.query(
        sql.toString(),
        params,
        (rs, rowNum) ->
            new KindStatusCount(
                NotificationKind.fromValue(rs.getString("notification_kind")),
                SendStatus.fromValue(rs.getString("status")),
                rs.getLong("cnt")));
  }

  private SendLedgerEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SendLedgerEntry(
        UUID.fromString(rs.getString("entry_id")),
        NotificationKind.fromValue(rs.getString("notification_kind")),
        rs.getString("recipient_id"),
        rs.getString("recipient_email"),
        rs.getString("subject"),
        SendStatus.fromValue(rs.getString("status")),
        rs.getString("error_message"),
        rs.getTimestamp("sent_at").toInstant());
  }

  public record KindStatusCount(NotificationKind kind, SendStatus status, long count) {}
}
