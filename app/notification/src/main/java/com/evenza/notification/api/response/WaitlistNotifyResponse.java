package com.evenza.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WaitlistNotifyResponse(String message, boolean alreadyNotified) {

  public static WaitlistNotifyResponse created() {
    return new WaitlistNotifyResponse("Notification created", false);
  }

  public static WaitlistNotifyResponse repeat() {
    return new WaitlistNotifyResponse("Already notified", true);
  }
}
