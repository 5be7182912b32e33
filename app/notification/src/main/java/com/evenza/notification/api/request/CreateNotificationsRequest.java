/*
 * Where: Notification API request DTO
 * What: Body of POST /api/notifications
 * Why: Organizers address an explicit recipient list instead of an event's registrants
 */
package com.evenza.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "request DTO is only read once by the service")
public record CreateNotificationsRequest(
    @NotEmpty(message = "recipients must be a non-empty array") List<Long> recipients,
    Long eventId,
    @NotBlank(message = "title is required") String title,
    @NotBlank(message = "message is required") String message,
    String status,
    String scheduledAt) {}
