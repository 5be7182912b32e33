/*
 * Where: Notification API
 * What: Status change that the lifecycle forbids
 * Why: Sent is terminal; the conflict is reported instead of silently ignored
 */
package com.evenza.notification.api;

public class InvalidAnnouncementTransitionException extends RuntimeException {
  public InvalidAnnouncementTransitionException(String message) {
    super(message);
  }
}
