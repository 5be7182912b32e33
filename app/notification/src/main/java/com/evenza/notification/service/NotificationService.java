/*
 * Where: Notification service layer
 * What: Inbox, organizer and waitlist operations on notification rows
 * Why: Recipients own read state, organizers own the rows they scheduled
 */
package com.evenza.notification.service;

import com.evenza.notification.api.InvalidAnnouncementRequestException;
import com.evenza.notification.api.InvalidAnnouncementTransitionException;
import com.evenza.notification.api.NotificationAccessDeniedException;
import com.evenza.notification.api.NotificationNotFoundException;
import com.evenza.notification.api.request.CreateNotificationsRequest;
import com.evenza.notification.api.request.UpdateNotificationRequest;
import com.evenza.notification.api.response.BulkCreateResponse;
import com.evenza.notification.api.response.MarkReadResponse;
import com.evenza.notification.api.response.NotificationListResponse;
import com.evenza.notification.api.response.NotificationSummary;
import com.evenza.notification.api.response.OkResponse;
import com.evenza.notification.api.response.WaitlistNotifyResponse;
import com.evenza.notification.model.DispatchRequest;
import com.evenza.notification.model.DispatchResult;
import com.evenza.notification.model.NotificationRecord;
import com.evenza.notification.model.NotificationStatus;
import com.evenza.notification.repository.EventRepository;
import com.evenza.notification.repository.NotificationRepository;
import com.evenza.notification.repository.RegistrationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

  private final NotificationRepository notificationRepository;
  private final RegistrationRepository registrationRepository;
  private final EventRepository eventRepository;
  private final AnnouncementDispatcher dispatcher;
  private final NotificationMetrics metrics;
  private final Clock clock;

  public NotificationListResponse listForUser(long userId) {
    return toListResponse(notificationRepository.findByUserId(userId));
  }

  public NotificationListResponse listForOwner(long ownerId, Long eventId) {
    return toListResponse(notificationRepository.findByOwner(ownerId, eventId));
  }

  /** Idempotent: marking an already read notification succeeds without a write. */
  @Transactional
  public MarkReadResponse markRead(long notificationId, long userId) {
    final NotificationRecord notification =
        notificationRepository
            .findById(notificationId)
            .orElseThrow(() -> new NotificationNotFoundException(notificationId));
    if (!notification.ownedBy(userId)) {
      throw new NotificationAccessDeniedException(notificationId);
    }
    if (notificationRepository.markRead(notificationId, userId) > 0) {
      metrics.recordRead();
    }
    return new MarkReadResponse(true, notificationId);
  }

  @Transactional
  public BulkCreateResponse bulkCreate(long ownerId, CreateNotificationsRequest request) {
    final List<Long> recipients = request.recipients();
    if (recipients == null || recipients.isEmpty()) {
      throw new InvalidAnnouncementRequestException("recipients must be a non-empty array");
    }
    if (recipients.stream().anyMatch(Objects::isNull)) {
      throw new InvalidAnnouncementRequestException("recipients must not contain null");
    }
    final String title = requireText(request.title(), "title");
    final String message = requireText(request.message(), "message");
    final NotificationStatus status = parseStatus(request.status(), NotificationStatus.PENDING);
    Instant scheduledAt = null;
    if (status == NotificationStatus.SCHEDULED) {
      if (request.scheduledAt() == null || request.scheduledAt().isBlank()) {
        throw new InvalidAnnouncementRequestException(
            "scheduled_at is required when status is scheduled");
      }
      scheduledAt = ScheduleTimes.parse(request.scheduledAt());
    }
    final DispatchResult result =
        dispatcher.dispatch(
            recipients,
            new DispatchRequest(
                null,
                request.eventId(),
                title,
                message,
                ownerId,
                ownerId,
                status,
                scheduledAt));
    logger.info(
        "notifications created ownerId={} eventId={} status={} inserted={} requested={}",
        ownerId,
        request.eventId(),
        status.columnValue(),
        result.inserted(),
        result.requested());
    return new BulkCreateResponse(true, result.inserted(), result.requested());
  }

  @Transactional
  public OkResponse updateOwned(long notificationId, long ownerId, UpdateNotificationRequest request) {
    final NotificationRecord current = findOwned(notificationId, ownerId);
    final NotificationStatus target = parseStatus(request.status(), current.status());
    if (current.status() == NotificationStatus.SENT && target != NotificationStatus.SENT) {
      throw new InvalidAnnouncementTransitionException(
          "notification already sent: " + notificationId);
    }
    final String title =
        request.title() == null ? current.title() : requireText(request.title(), "title");
    final String message =
        request.message() == null ? current.message() : requireText(request.message(), "message");
    Instant scheduledAt = current.scheduledAt();
    if (request.scheduledAt() != null) {
      scheduledAt = request.scheduledAt().isBlank() ? null : ScheduleTimes.parse(request.scheduledAt());
    }
    if (target == NotificationStatus.SCHEDULED && scheduledAt == null) {
      throw new InvalidAnnouncementRequestException(
          "scheduled_at is required when status is scheduled");
    }
    Instant sentAt = null;
    if (target == NotificationStatus.SENT) {
      sentAt = current.sentAt() != null ? current.sentAt() : Instant.now(clock);
    }
    final NotificationRecord updated =
        new NotificationRecord(
            current.notificationId(),
            current.userId(),
            current.eventId(),
            current.announcementId(),
            current.createdBy(),
            current.type(),
            title,
            message,
            target,
            current.read(),
            scheduledAt,
            current.scheduledBy(),
            current.attempts(),
            current.errorMessage(),
            current.createdAt(),
            sentAt);
    if (notificationRepository.updateOwned(updated, ownerId) == 0) {
      throw new InvalidAnnouncementTransitionException(
          "notification already sent: " + notificationId);
    }
    return OkResponse.OK;
  }

  @Transactional
  public OkResponse sendOwned(long notificationId, long ownerId) {
    if (notificationRepository.markSentByOwner(notificationId, ownerId, Instant.now(clock)) == 0) {
      throw notOwned(notificationId);
    }
    logger.info("notification sent by owner notificationId={} ownerId={}", notificationId, ownerId);
    return OkResponse.OK;
  }

  /** Creates at most one pending in-app notification per (user, event). */
  @Transactional
  public WaitlistNotifyResponse notifyWaitlist(long registrationId, long userId) {
    final long eventId =
        registrationRepository
            .findEventIdForUser(registrationId, userId)
            .orElseThrow(
                () -> new NotificationNotFoundException("registration not found: " + registrationId));
    if (notificationRepository.existsInAppForUserAndEvent(userId, eventId)) {
      return WaitlistNotifyResponse.repeat();
    }
    final String eventTitle =
        eventRepository
            .findTitleById(eventId)
            .orElseThrow(() -> new NotificationNotFoundException("event not found: " + eventId));
    dispatcher.dispatch(
        List.of(userId),
        new DispatchRequest(
            null,
            eventId,
            "Waitlist Notification: " + eventTitle,
            "You will be notified when a spot opens for \"" + eventTitle + "\".",
            userId,
            null,
            NotificationStatus.PENDING,
            null));
    return WaitlistNotifyResponse.created();
  }

  private NotificationRecord findOwned(long notificationId, long ownerId) {
    return notificationRepository
        .findById(notificationId)
        .filter(record -> Objects.equals(record.scheduledBy(), ownerId))
        .orElseThrow(() -> notOwned(notificationId));
  }

  private NotificationNotFoundException notOwned(long notificationId) {
    return new NotificationNotFoundException(
        "notification not found or not owned by caller: " + notificationId);
  }

  private NotificationStatus parseStatus(String raw, NotificationStatus fallback) {
    if (raw == null) {
      return fallback;
    }
    return NotificationStatus.parse(raw)
        .orElseThrow(
            () ->
                new InvalidAnnouncementRequestException(
                    "status must be one of pending, scheduled, sent"));
  }

  private static NotificationListResponse toListResponse(List<NotificationRecord> records) {
    return new NotificationListResponse(records.stream().map(NotificationSummary::from).toList());
  }

  private static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new InvalidAnnouncementRequestException(field + " is required");
    }
    return value;
  }
}
