/*
 * Where: Notification domain model
 * What: Snapshot of an announcements row
 * Why: Shared by the request path and the scheduled sweep
 */
package com.evenza.notification.model;

import java.time.Instant;

public record AnnouncementRecord(
    Long announcementId,
    Long eventId,
    String title,
    String message,
    AnnouncementStatus status,
    Instant scheduledAt,
    long createdBy,
    Instant createdAt,
    Instant updatedAt,
    Instant sentAt,
    int dispatchAttempts,
    String lastError) {

  public AnnouncementRecord withId(long id) {
    return new AnnouncementRecord(
        id,
        eventId,
        title,
        message,
        status,
        scheduledAt,
        createdBy,
        createdAt,
        updatedAt,
        sentAt,
        dispatchAttempts,
        lastError);
  }
}
