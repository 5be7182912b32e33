/*
 * Where: Notification service layer
 * What: Request-path operations of the announcement lifecycle
 * Why: Keeps draft, scheduled and sent transitions and their fan-out in one transaction
 */
package com.evenza.notification.service;

import com.evenza.notification.api.AnnouncementNotFoundException;
import com.evenza.notification.api.InvalidAnnouncementRequestException;
import com.evenza.notification.api.InvalidAnnouncementTransitionException;
import com.evenza.notification.api.request.CreateAnnouncementRequest;
import com.evenza.notification.api.request.SendAnnouncementRequest;
import com.evenza.notification.api.request.UpdateAnnouncementRequest;
import com.evenza.notification.api.response.AnnouncementListResponse;
import com.evenza.notification.api.response.AnnouncementSummary;
import com.evenza.notification.api.response.AnnouncementWriteResponse;
import com.evenza.notification.api.response.ClearAnnouncementsResponse;
import com.evenza.notification.api.response.DispatchResponse;
import com.evenza.notification.model.AnnouncementLookup;
import com.evenza.notification.model.AnnouncementRecord;
import com.evenza.notification.model.AnnouncementStatus;
import com.evenza.notification.model.DispatchRequest;
import com.evenza.notification.model.DispatchResult;
import com.evenza.notification.model.NotificationRecord;
import com.evenza.notification.model.NotificationStatus;
import com.evenza.notification.repository.AnnouncementRepository;
import com.evenza.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AnnouncementService {

  private static final Logger logger = LoggerFactory.getLogger(AnnouncementService.class);

  private final AnnouncementRepository announcementRepository;
  private final NotificationRepository notificationRepository;
  private final RecipientResolver recipientResolver;
  private final AnnouncementDispatcher dispatcher;
  private final Clock clock;

  @Transactional
  public AnnouncementWriteResponse create(long creatorId, CreateAnnouncementRequest request) {
    final String title = requireText(request.title(), "title");
    final String message = requireText(request.message(), "message");
    final AnnouncementStatus status = AnnouncementStatus.fromInput(request.status());
    final boolean dispatchNow =
        status == AnnouncementStatus.SENT || Boolean.TRUE.equals(request.markSent());
    final Instant now = Instant.now(clock);

    Instant scheduledAt = null;
    if (status == AnnouncementStatus.SCHEDULED) {
      if (isBlank(request.scheduledAt())) {
        throw new InvalidAnnouncementRequestException(
            "scheduled_at is required when status is scheduled");
      }
      scheduledAt = ScheduleTimes.parseNotPast(request.scheduledAt(), now);
    } else if (!isBlank(request.scheduledAt())) {
      scheduledAt = ScheduleTimes.parse(request.scheduledAt());
    }
    final Long eventId =
        recipientResolver.resolveEventId(request.eventId(), request.eventTitle()).orElse(null);

    // A row that is about to be sent starts as a draft; markSent moves it to Sent.
    final AnnouncementStatus storedStatus = dispatchNow ? AnnouncementStatus.DRAFT : status;
    final long announcementId =
        announcementRepository.insert(
            new AnnouncementRecord(
                null,
                eventId,
                title,
                message,
                storedStatus,
                dispatchNow ? null : scheduledAt,
                creatorId,
                now,
                now,
                null,
                0,
                null));
    logger.info(
        "announcement created announcementId={} eventId={} status={} createdBy={}",
        announcementId,
        eventId,
        status.toAnnouncementColumn(),
        creatorId);
    if (!dispatchNow) {
      return AnnouncementWriteResponse.saved(announcementId);
    }
    final DispatchResult result =
        dispatchAndMarkSent(announcementId, eventId, title, message, creatorId, now);
    return AnnouncementWriteResponse.dispatched(announcementId, DispatchResponse.from(result));
  }

  /**
   * Applies the provided fields. An id that only exists as a notification is materialized into a
   * new announcement whose id is returned.
   */
  @Transactional
  public AnnouncementWriteResponse update(
      long announcementId, long updaterId, UpdateAnnouncementRequest request) {
    final Instant now = Instant.now(clock);
    final AnnouncementLookup lookup = announcementRepository.findOrMaterialize(announcementId);
    if (lookup instanceof AnnouncementLookup.Found found) {
      return updateExisting(found.announcement(), updaterId, request, now);
    }
    if (lookup instanceof AnnouncementLookup.MaterializedFrom materialized) {
      return materialize(materialized.notification(), updaterId, request, now);
    }
    throw new AnnouncementNotFoundException(announcementId);
  }

  /** Immediate fan-out with no announcement row. */
  @Transactional
  public DispatchResponse sendNow(long creatorId, SendAnnouncementRequest request) {
    final String title = requireText(request.title(), "title");
    final String message = requireText(request.message(), "message");
    final boolean markSent = request.markSent() == null || request.markSent();
    final Long eventId =
        recipientResolver.resolveEventId(request.eventId(), request.eventTitle()).orElse(null);
    final List<Long> recipients = recipientResolver.resolveRecipients(eventId);
    final DispatchResult result =
        dispatcher.dispatch(
            recipients,
            new DispatchRequest(
                null,
                eventId,
                title,
                message,
                creatorId,
                creatorId,
                markSent ? NotificationStatus.SENT : NotificationStatus.PENDING,
                null));
    return DispatchResponse.from(result);
  }

  public AnnouncementListResponse list() {
    final List<AnnouncementSummary> announcements =
        notificationRepository.findAnnouncementViews().stream()
            .map(AnnouncementSummary::from)
            .toList();
    return new AnnouncementListResponse(announcements);
  }

  /** Deletes every announcements row; delivered notifications stay in the inboxes. */
  @Transactional
  public ClearAnnouncementsResponse clear(long requestedBy) {
    final int deleted = announcementRepository.deleteAll();
    logger.warn("announcements cleared deleted={} requestedBy={}", deleted, requestedBy);
    return new ClearAnnouncementsResponse(true, deleted);
  }

  private AnnouncementWriteResponse updateExisting(
      AnnouncementRecord current,
      long updaterId,
      UpdateAnnouncementRequest request,
      Instant now) {
    final long announcementId = current.announcementId();
    if (current.status().isTerminal()) {
      throw new InvalidAnnouncementTransitionException(
          "announcement already sent: " + announcementId);
    }
    final AnnouncementStatus target =
        request.status() == null ? current.status() : AnnouncementStatus.fromInput(request.status());
    final String title =
        request.title() == null ? current.title() : requireText(request.title(), "title");
    final String message =
        request.message() == null ? current.message() : requireText(request.message(), "message");
    final Long eventId =
        request.eventId() == null ? current.eventId() : parseEventId(request.eventId());
    final Instant scheduledAt =
        resolveScheduledAt(request.scheduledAt(), current.scheduledAt(), target, now);

    final boolean dispatchNow = target == AnnouncementStatus.SENT;
    final AnnouncementRecord updated =
        new AnnouncementRecord(
            announcementId,
            eventId,
            title,
            message,
            dispatchNow ? AnnouncementStatus.DRAFT : target,
            scheduledAt,
            current.createdBy(),
            current.createdAt(),
            now,
            null,
            current.dispatchAttempts(),
            current.lastError());
    if (announcementRepository.update(updated) == 0) {
      throw new InvalidAnnouncementTransitionException(
          "announcement already sent: " + announcementId);
    }
    logger.info(
        "announcement updated announcementId={} from={} to={} updatedBy={}",
        announcementId,
        current.status().toAnnouncementColumn(),
        target.toAnnouncementColumn(),
        updaterId);
    if (!dispatchNow) {
      return AnnouncementWriteResponse.saved(announcementId);
    }
    final DispatchResult result =
        dispatchAndMarkSent(announcementId, eventId, title, message, updaterId, now);
    return AnnouncementWriteResponse.dispatched(announcementId, DispatchResponse.from(result));
  }

  private AnnouncementWriteResponse materialize(
      NotificationRecord source, long updaterId, UpdateAnnouncementRequest request, Instant now) {
    final AnnouncementStatus target = AnnouncementStatus.fromInput(request.status());
    final String title =
        request.title() == null ? source.title() : requireText(request.title(), "title");
    final String message =
        request.message() == null ? source.message() : requireText(request.message(), "message");
    final Long eventId =
        request.eventId() == null ? source.eventId() : parseEventId(request.eventId());
    final Instant scheduledAt =
        resolveScheduledAt(request.scheduledAt(), source.scheduledAt(), target, now);
    final boolean dispatchNow = target == AnnouncementStatus.SENT;

    final long announcementId =
        announcementRepository.insert(
            new AnnouncementRecord(
                null,
                eventId,
                title,
                message,
                dispatchNow ? AnnouncementStatus.DRAFT : target,
                scheduledAt,
                updaterId,
                now,
                now,
                null,
                0,
                null));
    logger.info(
        "announcement materialized announcementId={} fromNotificationId={} status={}",
        announcementId,
        source.notificationId(),
        target.toAnnouncementColumn());
    if (!dispatchNow) {
      return AnnouncementWriteResponse.saved(announcementId);
    }
    final DispatchResult result =
        dispatchAndMarkSent(announcementId, eventId, title, message, updaterId, now);
    return AnnouncementWriteResponse.dispatched(announcementId, DispatchResponse.from(result));
  }

  private DispatchResult dispatchAndMarkSent(
      long announcementId,
      Long eventId,
      String title,
      String message,
      long dispatcherId,
      Instant now) {
    final List<Long> recipients = recipientResolver.resolveRecipients(eventId);
    final DispatchResult result =
        dispatcher.dispatch(
            recipients,
            DispatchRequest.sent(announcementId, eventId, title, message, dispatcherId, dispatcherId));
    if (announcementRepository.markSent(announcementId, now) == 0) {
      // Another path committed Sent first; rolling back drops this fan-out.
      throw new InvalidAnnouncementTransitionException(
          "announcement already sent: " + announcementId);
    }
    return result;
  }

  /**
   * A provided value must parse, and must not be in the past when the result is scheduled. An
   * empty string clears the stored value.
   */
  private Instant resolveScheduledAt(
      String provided, Instant existing, AnnouncementStatus target, Instant now) {
    Instant scheduledAt = existing;
    if (provided != null) {
      if (provided.isBlank()) {
        scheduledAt = null;
      } else if (target == AnnouncementStatus.SCHEDULED) {
        scheduledAt = ScheduleTimes.parseNotPast(provided, now);
      } else {
        scheduledAt = ScheduleTimes.parse(provided);
      }
    }
    if (target == AnnouncementStatus.SCHEDULED && scheduledAt == null) {
      throw new InvalidAnnouncementRequestException(
          "scheduled_at is required when status is scheduled");
    }
    return scheduledAt;
  }

  private Long parseEventId(String raw) {
    if (raw.isBlank()) {
      return null;
    }
    return RecipientResolver.parseId(raw)
        .orElseThrow(() -> new InvalidAnnouncementRequestException("event_id must be numeric"));
  }

  private static String requireText(String value, String field) {
    if (isBlank(value)) {
      throw new InvalidAnnouncementRequestException(field + " is required");
    }
    return value;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
