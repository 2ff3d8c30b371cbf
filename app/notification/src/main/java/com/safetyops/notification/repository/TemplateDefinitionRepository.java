/*
 * Where: Notification data access
 * What: Looks up the template for a notification kind
 * Why: Dispatch renders whatever the administrator last saved for the kind
 */
package com.safetyops.notification.repository;

import com.safetyops.notification.model.NotificationKind;
import com.safetyops.notification.model.TemplateDefinition;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TemplateDefinitionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<TemplateDefinition> findByKind(NotificationKind kind) {
    final String sql =
        """
        SELECT notification_kind, subject, content, enabled
        FROM template_definitions
        WHERE notification_kind = :kind
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("kind", kind.name());
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new TemplateDefinition(
                    NotificationKind.fromValue(rs.getString("notification_kind")),
                    rs.getString("subject"),
                    rs.getString("content"),
                    rs.getBoolean("enabled")))
        .stream()
        .findFirst();
  }
}
