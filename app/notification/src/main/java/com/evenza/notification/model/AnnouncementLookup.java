/*
 * Where: Notification domain model
 * What: Result of resolving an announcement id that may only exist as a legacy notification
 * Why: Callers branch on an explicit variant instead of checking two nullable lookups
 */
package com.evenza.notification.model;

public sealed interface AnnouncementLookup
    permits AnnouncementLookup.Found, AnnouncementLookup.MaterializedFrom, AnnouncementLookup.NotFound {

  record Found(AnnouncementRecord announcement) implements AnnouncementLookup {}

  /** No announcements row yet; the id belongs to a notification that seeds a new one. */
  record MaterializedFrom(NotificationRecord notification) implements AnnouncementLookup {}

  record NotFound(long id) implements AnnouncementLookup {}
}
