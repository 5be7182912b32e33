/*
 * Where: Notification service layer
 * What: Fans one announcement out into one in-app notification row per recipient
 * Why: Shared by the request path, the sweep and organizer bulk sends
 */
package com.evenza.notification.service;

import com.evenza.notification.api.AnnouncementDispatchException;
import com.evenza.notification.model.DispatchRequest;
import com.evenza.notification.model.DispatchResult;
import com.evenza.notification.model.NotificationRecord;
import com.evenza.notification.model.NotificationStatus;
import com.evenza.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AnnouncementDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(AnnouncementDispatcher.class);

  private final NotificationRepository notificationRepository;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /**
   * Inserts the rows and reports how many were written. Must run inside the caller's transaction
   * so the rows commit together with the announcement's status change.
   */
  public DispatchResult dispatch(List<Long> recipients, DispatchRequest request) {
    if (recipients.isEmpty()) {
      metrics.recordDispatchResult("empty");
      logger.info(
          "announcement has no recipients announcementId={} eventId={}",
          request.announcementId(),
          request.eventId());
      return DispatchResult.empty();
    }
    final Instant now = Instant.now(clock);
    final Instant sentAt = request.status() == NotificationStatus.SENT ? now : null;
    final List<NotificationRecord> rows =
        recipients.stream()
            .map(
                userId ->
                    new NotificationRecord(
                        null,
                        userId,
                        request.eventId(),
                        request.announcementId(),
                        request.createdBy(),
                        NotificationRecord.TYPE_IN_APP,
                        request.title(),
                        request.message(),
                        request.status(),
                        false,
                        request.scheduledAt(),
                        request.scheduledBy(),
                        0,
                        null,
                        now,
                        sentAt))
            .toList();
    final int inserted;
    try {
      inserted = notificationRepository.insertAll(rows);
    } catch (DataAccessException ex) {
      metrics.recordDispatchResult("failed");
      throw new AnnouncementDispatchException(
          "failed to write notifications for announcement " + request.announcementId(), ex);
    }
    metrics.recordDispatchResult("sent");
    metrics.recordFanOut(inserted);
    logger.info(
        "announcement fanned out announcementId={} eventId={} status={} inserted={} requested={}",
        request.announcementId(),
        request.eventId(),
        request.status().columnValue(),
        inserted,
        rows.size());
    return new DispatchResult(inserted, rows.size());
  }
}
