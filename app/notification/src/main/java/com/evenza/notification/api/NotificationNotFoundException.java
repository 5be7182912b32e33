/*
 * Where: Notification API
 * What: Missing notification, or one the caller does not own as organizer
 * Why: Owner routes answer 404 rather than revealing rows of other organizers
 */
package com.evenza.notification.api;

public class NotificationNotFoundException extends RuntimeException {
  public NotificationNotFoundException(long notificationId) {
    super("notification not found: " + notificationId);
  }

  public NotificationNotFoundException(String message) {
    super(message);
  }
}
