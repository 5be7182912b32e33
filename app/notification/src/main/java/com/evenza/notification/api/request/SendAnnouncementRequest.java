package com.evenza.notification.api.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendAnnouncementRequest(
    String eventId,
    String eventTitle,
    @NotBlank(message = "title is required") String title,
    @NotBlank(message = "message is required") String message,
    @JsonProperty("markSent") @JsonAlias("mark_sent") Boolean markSent) {}
