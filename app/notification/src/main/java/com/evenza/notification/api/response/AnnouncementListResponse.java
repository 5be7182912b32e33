package com.evenza.notification.api.response;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record AnnouncementListResponse(List<AnnouncementSummary> announcements) {
  public AnnouncementListResponse {
    // EI_EXPOSE_REP: keep an unmodifiable copy.
    announcements =
        announcements == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(announcements));
  }

  @Override
  public List<AnnouncementSummary> announcements() {
    return Collections.unmodifiableList(new ArrayList<>(announcements));
  }
}
