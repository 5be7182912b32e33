package com.evenza.notification.api.response;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record NotificationListResponse(List<NotificationSummary> notifications) {
  public NotificationListResponse {
    // EI_EXPOSE_REP: keep an unmodifiable copy.
    notifications =
        notifications == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(notifications));
  }

  @Override
  public List<NotificationSummary> notifications() {
    return Collections.unmodifiableList(new ArrayList<>(notifications));
  }
}
