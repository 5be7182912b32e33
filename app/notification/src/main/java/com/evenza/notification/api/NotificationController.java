/*
 * Where: Notification API
 * What: Inbox and organizer endpoints for notification rows
 * Why: Recipients read their inbox, organizers manage the rows they scheduled
 */
package com.evenza.notification.api;

import com.evenza.notification.api.request.CreateNotificationsRequest;
import com.evenza.notification.api.request.UpdateNotificationRequest;
import com.evenza.notification.api.response.BulkCreateResponse;
import com.evenza.notification.api.response.MarkReadResponse;
import com.evenza.notification.api.response.NotificationListResponse;
import com.evenza.notification.api.response.OkResponse;
import com.evenza.notification.service.NotificationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final NotificationService notificationService;

  @GetMapping("/user")
  public ResponseEntity<NotificationListResponse> listForUser(
      @RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(notificationService.listForUser(userId));
  }

  @GetMapping("/owner")
  public ResponseEntity<NotificationListResponse> listForOwner(
      @RequestHeader(HEADER_USER_ID) long userId,
      @RequestParam(name = "event_id", required = false) Long eventId) {
    return ResponseEntity.ok(notificationService.listForOwner(userId, eventId));
  }

  @PostMapping
  public ResponseEntity<BulkCreateResponse> create(
      @RequestHeader(HEADER_USER_ID) long userId,
      @Valid @RequestBody CreateNotificationsRequest request) {
    return ResponseEntity.ok(notificationService.bulkCreate(userId, request));
  }

  @PatchMapping("/{notificationId}")
  public ResponseEntity<OkResponse> update(
      @PathVariable("notificationId") long notificationId,
      @RequestHeader(HEADER_USER_ID) long userId,
      @RequestBody UpdateNotificationRequest request) {
    return ResponseEntity.ok(notificationService.updateOwned(notificationId, userId, request));
  }

  @PostMapping("/{notificationId}/send")
  public ResponseEntity<OkResponse> send(
      @PathVariable("notificationId") long notificationId,
      @RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(notificationService.sendOwned(notificationId, userId));
  }

  @PutMapping("/{notificationId}/read")
  public ResponseEntity<MarkReadResponse> markRead(
      @PathVariable("notificationId") long notificationId,
      @RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(notificationService.markRead(notificationId, userId));
  }
}
