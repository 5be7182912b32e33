package com.evenza.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Partial update. A null component means the field was not provided and keeps its value. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdateAnnouncementRequest(
    String eventId, String title, String message, String status, String scheduledAt) {}
