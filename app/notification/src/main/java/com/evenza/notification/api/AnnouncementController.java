/*
 * Where: Notification API
 * What: Announcement endpoints: list, create, update, send now, clear
 * Why: Organizers drive the announcement lifecycle over HTTP
 */
package com.evenza.notification.api;

import com.evenza.notification.api.request.CreateAnnouncementRequest;
import com.evenza.notification.api.request.SendAnnouncementRequest;
import com.evenza.notification.api.request.UpdateAnnouncementRequest;
import com.evenza.notification.api.response.AnnouncementListResponse;
import com.evenza.notification.api.response.AnnouncementWriteResponse;
import com.evenza.notification.api.response.ClearAnnouncementsResponse;
import com.evenza.notification.api.response.DispatchResponse;
import com.evenza.notification.service.AnnouncementService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/announcements")
@RequiredArgsConstructor
public class AnnouncementController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final AnnouncementService announcementService;

  @GetMapping
  public ResponseEntity<AnnouncementListResponse> list() {
    return ResponseEntity.ok(announcementService.list());
  }

  @PostMapping
  public ResponseEntity<AnnouncementWriteResponse> create(
      @RequestHeader(HEADER_USER_ID) long userId,
      @Valid @RequestBody CreateAnnouncementRequest request) {
    return ResponseEntity.ok(announcementService.create(userId, request));
  }

  @PatchMapping("/{announcementId}")
  public ResponseEntity<AnnouncementWriteResponse> update(
      @PathVariable("announcementId") long announcementId,
      @RequestHeader(HEADER_USER_ID) long userId,
      @RequestBody UpdateAnnouncementRequest request) {
    return ResponseEntity.ok(announcementService.update(announcementId, userId, request));
  }

  @PostMapping("/send")
  public ResponseEntity<DispatchResponse> send(
      @RequestHeader(HEADER_USER_ID) long userId,
      @Valid @RequestBody SendAnnouncementRequest request) {
    return ResponseEntity.ok(announcementService.sendNow(userId, request));
  }

  @DeleteMapping
  public ResponseEntity<ClearAnnouncementsResponse> clear(
      @RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(announcementService.clear(userId));
  }
}
