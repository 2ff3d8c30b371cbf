/*
 * Where: Notification data access
 * What: Reads schedule_definitions and writes back run timestamps
 * Why: The registry loads enabled schedules from here; admins edit the rows elsewhere
 */
package com.safetyops.notification.repository;

import static com.safetyops.common.JdbcTimestampUtils.toInstant;
import static com.safetyops.common.JdbcTimestampUtils.toTimestamp;

import com.safetyops.notification.model.ScheduleDefinition;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ScheduleDefinitionRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT id, name, cron_expression, notification_kind, description, is_enabled, last_run, next_run
      FROM schedule_definitions
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<ScheduleDefinition> findAllEnabled() {
    final String sql = SELECT_COLUMNS + " WHERE is_enabled = TRUE ORDER BY id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public Optional<ScheduleDefinition> findById(String id) {
    final String sql = SELECT_COLUMNS + " WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int updateRunTimes(String id, Instant lastRun, Instant nextRun) {
    final String sql =
        """
        UPDATE schedule_definitions
        SET last_run = :lastRun,
            next_run = :nextRun
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("lastRun", toTimestamp(lastRun))
            .addValue("nextRun", toTimestamp(nextRun));
    return jdbcTemplate.update(sql, params);
  }

  private ScheduleDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ScheduleDefinition(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("cron_expression"),
        rs.getString("notification_kind"),
        rs.getString("description"),
        rs.getBoolean("is_enabled"),
        toInstant(rs.getTimestamp("last_run")),
        toInstant(rs.getTimestamp("next_run")));
  }
}
