/*
 * Where: Notification API
 * What: Fan-out could not be written
 * Why: Separates storage failures during dispatch from generic 500s
 */
package com.evenza.notification.api;

public class AnnouncementDispatchException extends RuntimeException {
  public AnnouncementDispatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
