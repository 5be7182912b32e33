package com.evenza.notification.api;

public class AnnouncementNotFoundException extends RuntimeException {
  public AnnouncementNotFoundException(long announcementId) {
    super("announcement not found: " + announcementId);
  }
}
