/*
 * Where: Notification data access
 * What: Read-only queries that find who should receive each scheduled reminder
 * Why: Each query is one round trip so a tick never issues a query per team or course
 */
package com.safetyops.notification.repository;

import static com.safetyops.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RecipientRepository {

  static final int COMPLETED_STEP = 3;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Users with an email who have not completed an active course, one row per (course, user). */
  public List<IncompleteCourseRow> findIncompleteCourseUsers() {
    final String sql =
        """
        SELECT c.id AS course_id, c.title AS course_title, u.id AS user_id, u.username, u.email
        FROM courses c
        CROSS JOIN users u
        WHERE c.is_active = TRUE
          AND u.email IS NOT NULL
          AND NOT EXISTS (
            SELECT 1
            FROM user_progress p
            WHERE p.user_id = u.id
              AND p.course_id = c.id
              AND p.current_step = :completedStep
          )
        ORDER BY c.title, u.id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("completedStep", COMPLETED_STEP);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new IncompleteCourseRow(
                rs.getString("course_id"),
                rs.getString("course_title"),
                rs.getString("user_id"),
                rs.getString("username"),
                rs.getString("email")));
  }

  /** Team leaders with an email whose team has no daily report created at or after {@code since}. */
  public List<TeamLeaderRow> findLeadersOfTeamsWithoutReportSince(Instant since) {
    final String sql =
        """
        SELECT t.id AS team_id, t.name AS team_name, u.id AS user_id, u.username, u.email
        FROM teams t
        JOIN users u ON u.team_id = t.id
        WHERE u.role = 'TEAM_LEADER'
          AND u.email IS NOT NULL
          AND NOT EXISTS (
            SELECT 1
            FROM daily_reports r
            WHERE r.team_id = t.id
              AND r.created_at >= :since
          )
        ORDER BY t.name, u.id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since));
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new TeamLeaderRow(
                rs.getString("team_id"),
                rs.getString("team_name"),
                rs.getString("user_id"),
                rs.getString("username"),
                rs.getString("email")));
  }

  public List<UserRow> findManagersWithEmail() {
    final String sql =
        """
        SELECT id, username, email
        FROM users
        WHERE role IN ('TEAM_LEADER', 'ADMIN')
          AND email IS NOT NULL
        ORDER BY id
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new UserRow(rs.getString("id"), rs.getString("username"), rs.getString("email")));
  }

  public record IncompleteCourseRow(
      String courseId, String courseTitle, String userId, String username, String email) {}

  public record TeamLeaderRow(
      String teamId, String teamName, String userId, String username, String email) {}

  public record UserRow(String userId, String username, String email) {}
}
