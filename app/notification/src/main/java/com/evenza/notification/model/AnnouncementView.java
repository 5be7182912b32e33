/*
 * Where: Notification domain model
 * What: Announcement projection derived from grouped in-app notifications
 * Why: Historical dispatches predate the announcements table
 */
package com.evenza.notification.model;

import java.time.Instant;

public record AnnouncementView(
    long announcementId,
    Long eventId,
    String title,
    String message,
    AnnouncementStatus status,
    Instant scheduledAt,
    Instant createdAt,
    Instant sentAt) {}
