/*
 * Where: shared JDBC helpers
 * What: Converts between Instant and java.sql.Timestamp for named-parameter binding
 * Why: The PostgreSQL driver cannot infer a type for a bare Instant parameter
 */
package com.safetyops.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is always UTC; Timestamp.from keeps it that way regardless of the DB session zone
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
