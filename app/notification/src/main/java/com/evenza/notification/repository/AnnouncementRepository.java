/*
 * Where: Notification data access
 * What: Inserts, reads and transitions announcements rows
 * Why: Owns the lifecycle columns that the request path and the sweep both update
 */
package com.evenza.notification.repository;

import static com.evenza.common.jdbc.JdbcTimes.getInstant;
import static com.evenza.common.jdbc.JdbcTimes.getNullableLong;
import static com.evenza.common.jdbc.JdbcTimes.toTimestamp;

import com.evenza.notification.model.AnnouncementLookup;
import com.evenza.notification.model.AnnouncementRecord;
import com.evenza.notification.model.AnnouncementStatus;
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
public class AnnouncementRepository {

  private static final String COLUMNS =
      """
      announcement_id, event_id, title, message, status, scheduled_at, created_by,
      created_at, updated_at, sent_at, dispatch_attempts, last_error
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final NotificationRepository notificationRepository;

  public long insert(AnnouncementRecord record) {
    final String sql =
        """
        INSERT INTO announcements (
          event_id,
          title,
          message,
          status,
          scheduled_at,
          created_by,
          created_at,
          updated_at,
          sent_at
        ) VALUES (
          :eventId,
          :title,
          :message,
          :status,
          :scheduledAt,
          :createdBy,
          :createdAt,
          :updatedAt,
          :sentAt
        )
        RETURNING announcement_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", record.eventId())
            .addValue("title", record.title())
            .addValue("message", record.message())
            .addValue("status", record.status().toAnnouncementColumn())
            .addValue("scheduledAt", toTimestamp(record.scheduledAt()))
            .addValue("createdBy", record.createdBy())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()))
            .addValue("sentAt", toTimestamp(record.sentAt()));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("announcement insert returned no id");
    }
    return id;
  }

  public Optional<AnnouncementRecord> findById(long announcementId) {
    final String sql = "SELECT " + COLUMNS + " FROM announcements WHERE announcement_id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", announcementId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Resolves an id against announcements first and falls back to notifications, whose ids the
   * derived announcement list hands out. Nothing is written here; the caller inserts the
   * materialized row.
   */
  public AnnouncementLookup findOrMaterialize(long id) {
    final Optional<AnnouncementRecord> announcement = findById(id);
    if (announcement.isPresent()) {
      return new AnnouncementLookup.Found(announcement.get());
    }
    return notificationRepository
        .findById(id)
        .<AnnouncementLookup>map(AnnouncementLookup.MaterializedFrom::new)
        .orElseGet(() -> new AnnouncementLookup.NotFound(id));
  }

  /** Writes the editable columns. A row that is already Sent is never modified. */
  public int update(AnnouncementRecord record) {
    final String sql =
        """
        UPDATE announcements
        SET event_id = :eventId,
            title = :title,
            message = :message,
            status = :status,
            scheduled_at = :scheduledAt,
            updated_at = :updatedAt
        WHERE announcement_id = :id
          AND status <> 'Sent'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", record.eventId())
            .addValue("title", record.title())
            .addValue("message", record.message())
            .addValue("status", record.status().toAnnouncementColumn())
            .addValue("scheduledAt", toTimestamp(record.scheduledAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()))
            .addValue("id", record.announcementId());
    return jdbcTemplate.update(sql, params);
  }

  /** Sets Sent exactly once; returns 0 when another path already committed the transition. */
  public int markSent(long announcementId, Instant sentAt) {
    final String sql =
        """
        UPDATE announcements
        SET status = 'Sent',
            sent_at = :sentAt,
            updated_at = :sentAt,
            last_error = NULL
        WHERE announcement_id = :id
          AND status <> 'Sent'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("id", announcementId);
    return jdbcTemplate.update(sql, params);
  }

  /** Sweep variant of {@link #markSent}: only a row that is still Scheduled transitions. */
  public int markScheduledSent(long announcementId, Instant sentAt) {
    final String sql =
        """
        UPDATE announcements
        SET status = 'Sent',
            sent_at = :sentAt,
            updated_at = :sentAt,
            last_error = NULL
        WHERE announcement_id = :id
          AND status = 'Scheduled'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("id", announcementId);
    return jdbcTemplate.update(sql, params);
  }

  /** Failing rows sort behind fresh ones so a batch of them cannot stall the sweep. */
  public List<AnnouncementRecord> findDueScheduled(Instant now, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM announcements
            WHERE status = 'Scheduled'
              AND scheduled_at IS NOT NULL
              AND scheduled_at <= :now
            ORDER BY dispatch_attempts, scheduled_at, announcement_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int recordDispatchFailure(long announcementId, String error, Instant now) {
    final String sql =
        """
        UPDATE announcements
        SET dispatch_attempts = dispatch_attempts + 1,
            last_error = :error,
            updated_at = :now
        WHERE announcement_id = :id
          AND status = 'Scheduled'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("error", error)
            .addValue("now", toTimestamp(now))
            .addValue("id", announcementId);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteAll() {
    return jdbcTemplate.update("DELETE FROM announcements", new MapSqlParameterSource());
  }

  private AnnouncementRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AnnouncementRecord(
        rs.getLong("announcement_id"),
        getNullableLong(rs, "event_id"),
        rs.getString("title"),
        rs.getString("message"),
        AnnouncementStatus.fromAnnouncementColumn(rs.getString("status")),
        getInstant(rs, "scheduled_at"),
        rs.getLong("created_by"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"),
        getInstant(rs, "sent_at"),
        rs.getInt("dispatch_attempts"),
        rs.getString("last_error"));
  }
}
