/*
 * Where: Notification domain model
 * What: Snapshot of a notifications row, one recipient's delivery record
 * Why: Fan-out, inbox and owner views all read and write the same shape
 */
package com.evenza.notification.model;

import java.time.Instant;

public record NotificationRecord(
    Long notificationId,
    long userId,
    Long eventId,
    Long announcementId,
    long createdBy,
    String type,
    String title,
    String message,
    NotificationStatus status,
    boolean read,
    Instant scheduledAt,
    Long scheduledBy,
    int attempts,
    String errorMessage,
    Instant createdAt,
    Instant sentAt) {

  public static final String TYPE_IN_APP = "in-app";

  public boolean ownedBy(long requestingUserId) {
    return userId == requestingUserId;
  }
}
