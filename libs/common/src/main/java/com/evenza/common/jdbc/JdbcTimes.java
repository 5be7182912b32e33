/*
 * Where: Shared JDBC helpers
 * What: Converts between Instant and the JDBC timestamp types
 * Why: Repositories bind and read TIMESTAMPTZ columns the same way
 */
package com.evenza.common.jdbc;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimes {
  private JdbcTimes() {}

  // Instant is always UTC; Timestamp.from keeps it as-is regardless of the DB session time zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    return toInstant(rs.getTimestamp(column));
  }

  /** Reads a nullable BIGINT column without collapsing NULL to 0. */
  public static Long getNullableLong(ResultSet rs, String column) throws SQLException {
    final long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }
}
