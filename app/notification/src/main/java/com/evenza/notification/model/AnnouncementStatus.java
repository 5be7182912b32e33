/*
 * Where: Notification domain model
 * What: Announcement lifecycle state with its mappings to each stored vocabulary
 * Why: announcements stores Draft/Scheduled/Sent while notifications stores pending/scheduled/sent
 */
package com.evenza.notification.model;

import java.util.Locale;

public enum AnnouncementStatus {
  DRAFT("Draft", NotificationStatus.PENDING, 0),
  SCHEDULED("Scheduled", NotificationStatus.SCHEDULED, 1),
  SENT("Sent", NotificationStatus.SENT, 2);

  private final String columnValue;
  private final NotificationStatus notificationStatus;
  private final int rank;

  AnnouncementStatus(String columnValue, NotificationStatus notificationStatus, int rank) {
    this.columnValue = columnValue;
    this.notificationStatus = notificationStatus;
    this.rank = rank;
  }

  /**
   * Normalizes a client supplied status. Matching is case-insensitive; {@code pending}, blank and
   * unknown values all fall back to {@link #DRAFT}.
   */
  public static AnnouncementStatus fromInput(String raw) {
    if (raw == null || raw.isBlank()) {
      return DRAFT;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "scheduled" -> SCHEDULED;
      case "sent" -> SENT;
      default -> DRAFT;
    };
  }

  public static AnnouncementStatus fromAnnouncementColumn(String value) {
    for (AnnouncementStatus status : values()) {
      if (status.columnValue.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown announcement status column value: " + value);
  }

  public static AnnouncementStatus fromNotificationColumn(String value) {
    return fromNotificationStatus(NotificationStatus.fromColumn(value));
  }

  public static AnnouncementStatus fromNotificationStatus(NotificationStatus status) {
    return switch (status) {
      case SENT -> SENT;
      case SCHEDULED -> SCHEDULED;
      case PENDING -> DRAFT;
    };
  }

  /** Derived list status: the highest rank wins, anything unrecognized is a draft. */
  public static AnnouncementStatus fromRank(int rank) {
    if (rank >= SENT.rank) {
      return SENT;
    }
    if (rank == SCHEDULED.rank) {
      return SCHEDULED;
    }
    return DRAFT;
  }

  public String toAnnouncementColumn() {
    return columnValue;
  }

  public String toNotificationColumn() {
    return notificationStatus.columnValue();
  }

  public NotificationStatus toNotificationStatus() {
    return notificationStatus;
  }

  public String toClientValue() {
    return columnValue;
  }

  public int rank() {
    return rank;
  }

  public boolean isTerminal() {
    return this == SENT;
  }
}
