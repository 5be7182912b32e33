/*
 * Where: Notification data access
 * What: Inserts, reads and updates notifications rows
 * Why: Backs fan-out, the user inbox, the owner view and the derived announcement list
 */
package com.evenza.notification.repository;

import static com.evenza.common.jdbc.JdbcTimes.getInstant;
import static com.evenza.common.jdbc.JdbcTimes.getNullableLong;
import static com.evenza.common.jdbc.JdbcTimes.toTimestamp;

import com.evenza.notification.model.AnnouncementStatus;
import com.evenza.notification.model.AnnouncementView;
import com.evenza.notification.model.NotificationRecord;
import com.evenza.notification.model.NotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String COLUMNS =
      """
      notification_id, user_id, event_id, announcement_id, created_by, type, title, message,
      status, is_read, scheduled_at, scheduled_by, attempts, error_message, created_at, sent_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts one row per record. Rows that would duplicate an existing (announcement, recipient)
   * pair are skipped, so the returned count can be lower than {@code records.size()}.
   */
  public int insertAll(List<NotificationRecord> records) {
    if (records.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO notifications (
          user_id,
          event_id,
          announcement_id,
          created_by,
          type,
          title,
          message,
          status,
          is_read,
          scheduled_at,
          scheduled_by,
          attempts,
          error_message,
          created_at,
          sent_at
        ) VALUES (
          :userId,
          :eventId,
          :announcementId,
          :createdBy,
          :type,
          :title,
          :message,
          :status,
          :read,
          :scheduledAt,
          :scheduledBy,
          :attempts,
          :errorMessage,
          :createdAt,
          :sentAt
        )
        ON CONFLICT (announcement_id, user_id) WHERE announcement_id IS NOT NULL DO NOTHING
        """;
    final SqlParameterSource[] batch =
        records.stream().map(this::insertParams).toArray(SqlParameterSource[]::new);
    int inserted = 0;
    for (int count : jdbcTemplate.batchUpdate(sql, batch)) {
      inserted += Math.max(count, 0);
    }
    return inserted;
  }

  public Optional<NotificationRecord> findById(long notificationId) {
    final String sql = "SELECT " + COLUMNS + " FROM notifications WHERE notification_id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationRecord> findByUserId(long userId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notifications
            WHERE user_id = :userId
            ORDER BY created_at DESC, notification_id DESC
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationRecord> findByOwner(long ownerId, Long eventId) {
    final StringBuilder sql =
        new StringBuilder("SELECT ")
            .append(COLUMNS)
            .append(" FROM notifications WHERE scheduled_by = :ownerId");
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    if (eventId != null) {
      sql.append(" AND event_id = :eventId");
      params.addValue("eventId", eventId);
    }
    sql.append(" ORDER BY created_at DESC, notification_id DESC");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public boolean existsInAppForUserAndEvent(long userId, long eventId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM notifications
          WHERE user_id = :userId
            AND event_id = :eventId
            AND type = 'in-app'
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("eventId", eventId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  /** Flips is_read for the owning recipient only; an already read row is left untouched. */
  public int markRead(long notificationId, long userId) {
    final String sql =
        """
        UPDATE notifications
        SET is_read = TRUE
        WHERE notification_id = :id
          AND user_id = :userId
          AND is_read = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", notificationId).addValue("userId", userId);
    return jdbcTemplate.update(sql, params);
  }

  /** Owner edit. A row that is already sent can be edited but never leaves sent. */
  public int updateOwned(NotificationRecord record, long ownerId) {
    final String sql =
        """
        UPDATE notifications
        SET title = :title,
            message = :message,
            status = :status,
            scheduled_at = :scheduledAt,
            sent_at = :sentAt
        WHERE notification_id = :id
          AND scheduled_by = :ownerId
          AND (status <> 'sent' OR :status = 'sent')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("title", record.title())
            .addValue("message", record.message())
            .addValue("status", record.status().columnValue())
            .addValue("scheduledAt", toTimestamp(record.scheduledAt()))
            .addValue("sentAt", toTimestamp(record.sentAt()))
            .addValue("id", record.notificationId())
            .addValue("ownerId", ownerId);
    return jdbcTemplate.update(sql, params);
  }

  public int markSentByOwner(long notificationId, long ownerId, Instant sentAt) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'sent',
            sent_at = COALESCE(sent_at, :sentAt)
        WHERE notification_id = :id
          AND scheduled_by = :ownerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("id", notificationId)
            .addValue("ownerId", ownerId);
    return jdbcTemplate.update(sql, params);
  }

  public int promoteDueScheduled(Instant now) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'sent',
            sent_at = :now
        WHERE status = 'scheduled'
          AND scheduled_at IS NOT NULL
          AND scheduled_at <= :now
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Groups in-app notifications by (event, title, message). The group's status is the highest
   * ranked member status: sent over scheduled over anything else.
   */
  public List<AnnouncementView> findAnnouncementViews() {
    final String sql =
        """
        SELECT MIN(notification_id) AS announcement_id,
               event_id,
               title,
               message,
               MAX(CASE WHEN status = 'sent' THEN 2 WHEN status = 'scheduled' THEN 1 ELSE 0 END)
                 AS status_rank,
               MIN(created_at) AS created_at,
               MAX(scheduled_at) AS scheduled_at,
               MAX(sent_at) AS sent_at
        FROM notifications
        WHERE type = 'in-app'
          AND title IS NOT NULL
          AND message IS NOT NULL
        GROUP BY event_id, title, message
        ORDER BY created_at DESC
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new AnnouncementView(
                rs.getLong("announcement_id"),
                getNullableLong(rs, "event_id"),
                rs.getString("title"),
                rs.getString("message"),
                AnnouncementStatus.fromRank(rs.getInt("status_rank")),
                getInstant(rs, "scheduled_at"),
                getInstant(rs, "created_at"),
                getInstant(rs, "sent_at")));
  }

  private MapSqlParameterSource insertParams(NotificationRecord record) {
    return new MapSqlParameterSource()
        .addValue("userId", record.userId())
        .addValue("eventId", record.eventId())
        .addValue("announcementId", record.announcementId())
        .addValue("createdBy", record.createdBy())
        .addValue("type", record.type())
        .addValue("title", record.title())
        .addValue("message", record.message())
        .addValue("status", record.status().columnValue())
        .addValue("read", record.read())
        .addValue("scheduledAt", toTimestamp(record.scheduledAt()))
        .addValue("scheduledBy", record.scheduledBy())
        .addValue("attempts", record.attempts())
        .addValue("errorMessage", record.errorMessage())
        .addValue("createdAt", toTimestamp(record.createdAt()))
        .addValue("sentAt", toTimestamp(record.sentAt()));
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        rs.getLong("notification_id"),
        rs.getLong("user_id"),
        getNullableLong(rs, "event_id"),
        getNullableLong(rs, "announcement_id"),
        rs.getLong("created_by"),
        rs.getString("type"),
        rs.getString("title"),
        rs.getString("message"),
        NotificationStatus.fromColumn(rs.getString("status")),
        rs.getBoolean("is_read"),
        getInstant(rs, "scheduled_at"),
        getNullableLong(rs, "scheduled_by"),
        rs.getInt("attempts"),
        rs.getString("error_message"),
        getInstant(rs, "created_at"),
        getInstant(rs, "sent_at"));
  }
}
