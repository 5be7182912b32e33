/*
 * Where: Notification domain model
 * What: Delivery state of a single notification row
 * Why: Keeps the lowercase column vocabulary in one place
 */
package com.evenza.notification.model;

import java.util.Locale;
import java.util.Optional;

public enum NotificationStatus {
  PENDING("pending"),
  SCHEDULED("scheduled"),
  SENT("sent");

  private final String columnValue;

  NotificationStatus(String columnValue) {
    this.columnValue = columnValue;
  }

  public String columnValue() {
    return columnValue;
  }

  public static NotificationStatus fromColumn(String value) {
    return parse(value)
        .orElseThrow(
            () -> new IllegalArgumentException("unknown notification status column value: " + value));
  }

  /** Strict parse of client input: only pending, scheduled and sent are accepted. */
  public static Optional<NotificationStatus> parse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    final String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (NotificationStatus status : values()) {
      if (status.columnValue.equals(normalized)) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
