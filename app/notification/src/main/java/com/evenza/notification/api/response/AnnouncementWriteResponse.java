/*
 * Where: Notification API response DTO
 * What: Result of creating or updating an announcement
 * Why: sent is present only when the write fanned the announcement out
 */
package com.evenza.notification.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnnouncementWriteResponse(
    boolean ok, @JsonProperty("announcementId") long announcementId, DispatchResponse sent) {

  public static AnnouncementWriteResponse saved(long announcementId) {
    return new AnnouncementWriteResponse(true, announcementId, null);
  }

  public static AnnouncementWriteResponse dispatched(long announcementId, DispatchResponse sent) {
    return new AnnouncementWriteResponse(true, announcementId, sent);
  }
}
