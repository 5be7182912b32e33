package com.evenza.notification.model;

import java.time.Instant;

/**
 * Fields shared by every notification row produced by one fan-out. {@code scheduledBy} is the
 * organizer who sees the rows in the owner view; it is null for self-service rows.
 */
public record DispatchRequest(
    Long announcementId,
    Long eventId,
    String title,
    String message,
    long createdBy,
    Long scheduledBy,
    NotificationStatus status,
    Instant scheduledAt) {

  public static DispatchRequest sent(
      Long announcementId,
      Long eventId,
      String title,
      String message,
      long createdBy,
      Long scheduledBy) {
    return new DispatchRequest(
        announcementId, eventId, title, message, createdBy, scheduledBy, NotificationStatus.SENT, null);
  }
}
