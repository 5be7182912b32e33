package com.evenza.notification.api;

public class NotificationAccessDeniedException extends RuntimeException {
  public NotificationAccessDeniedException(long notificationId) {
    super("notification belongs to another user: " + notificationId);
  }
}
