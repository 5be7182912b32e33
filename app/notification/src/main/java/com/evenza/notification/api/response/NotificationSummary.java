/*
 * Where: Notification API response DTO
 * What: One notification row as seen by its recipient or its organizer
 * Why: Keeps the column vocabulary (pending/scheduled/sent) on the wire
 */
package com.evenza.notification.api.response;

import com.evenza.notification.model.NotificationRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    long notificationId,
    long userId,
    Long eventId,
    Long announcementId,
    String type,
    String title,
    String message,
    String status,
    @JsonProperty("is_read") boolean read,
    Instant scheduledAt,
    Long scheduledBy,
    Instant createdAt,
    Instant sentAt) {

  public static NotificationSummary from(NotificationRecord record) {
    return new NotificationSummary(
        record.notificationId(),
        record.userId(),
        record.eventId(),
        record.announcementId(),
        record.type(),
        record.title(),
        record.message(),
        record.status().columnValue(),
        record.read(),
        record.scheduledAt(),
        record.scheduledBy(),
        record.createdAt(),
        record.sentAt());
  }
}
