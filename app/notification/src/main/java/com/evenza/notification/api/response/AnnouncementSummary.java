package com.evenza.notification.api.response;

import com.evenza.notification.model.AnnouncementView;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnnouncementSummary(
    long announcementId,
    Long eventId,
    String title,
    String message,
    String status,
    Instant scheduledAt,
    Instant createdAt,
    Instant sentAt) {

  public static AnnouncementSummary from(AnnouncementView view) {
    return new AnnouncementSummary(
        view.announcementId(),
        view.eventId(),
        view.title(),
        view.message(),
        view.status().toClientValue(),
        view.scheduledAt(),
        view.createdAt(),
        view.sentAt());
  }
}
