package com.evenza.notification.api;

import com.evenza.notification.api.response.WaitlistNotifyResponse;
import com.evenza.notification.service.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/** Waitlisted registrants ask to be told when a spot opens. */
@RestController
@RequiredArgsConstructor
public class WaitlistController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final NotificationService notificationService;

  @PostMapping("/api/registrations/notify/{registrationId}")
  public ResponseEntity<WaitlistNotifyResponse> notifyWaitlist(
      @PathVariable("registrationId") long registrationId,
      @RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(notificationService.notifyWaitlist(registrationId, userId));
  }
}
