/*
 * Where: Notification data access
 * What: Read-only lookups against the registrations table
 * Why: Registrants of an event are the recipients of its announcements
 */
package com.evenza.notification.repository;

import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RegistrationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Every user with a registration row for the event, whatever its status. */
  public List<Long> findDistinctUserIdsByEventId(long eventId) {
    final String sql =
        """
        SELECT DISTINCT user_id
        FROM registrations
        WHERE event_id = :eventId
        ORDER BY user_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.queryForList(sql, params, Long.class);
  }

  public Optional<Long> findEventIdForUser(long registrationId, long userId) {
    final String sql =
        """
        SELECT event_id
        FROM registrations
        WHERE registration_id = :registrationId
          AND user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("registrationId", registrationId)
            .addValue("userId", userId);
    return jdbcTemplate.queryForList(sql, params, Long.class).stream().findFirst();
  }
}
