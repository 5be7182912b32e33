/*
 * Where: Notification data access
 * What: Read-only lookups against the events table
 * Why: Announcements may target an event by title instead of id
 */
package com.evenza.notification.repository;

import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<Long> findIdByTitle(String title) {
    final String sql =
        """
        SELECT event_id
        FROM events
        WHERE title = :title
        ORDER BY event_id
        LIMIT 1
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("title", title);
    return jdbcTemplate.queryForList(sql, params, Long.class).stream().findFirst();
  }

  public Optional<String> findTitleById(long eventId) {
    final String sql = "SELECT title FROM events WHERE event_id = :eventId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.queryForList(sql, params, String.class).stream().findFirst();
  }
}
