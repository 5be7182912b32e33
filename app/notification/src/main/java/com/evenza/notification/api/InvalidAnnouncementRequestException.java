/*
 * Where: Notification API
 * What: Rejected announcement or notification input
 * Why: Mapped to 400 before anything is written
 */
package com.evenza.notification.api;

public class InvalidAnnouncementRequestException extends RuntimeException {
  public InvalidAnnouncementRequestException(String message) {
    super(message);
  }
}
