/*
 * Where: Notification API request DTO
 * What: Body of POST /api/announcements
 * Why: event_id arrives as a JSON number or a string; markSent keeps its camelCase name
 */
package com.evenza.notification.api.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateAnnouncementRequest(
    String eventId,
    String eventTitle,
    @NotBlank(message = "title is required") String title,
    @NotBlank(message = "message is required") String message,
    String status,
    String scheduledAt,
    @JsonProperty("markSent") @JsonAlias("mark_sent") Boolean markSent) {}
