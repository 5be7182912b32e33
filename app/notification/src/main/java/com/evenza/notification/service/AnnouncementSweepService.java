/*
 * Where: Notification service layer
 * What: Dispatches scheduled announcements that are due and promotes due notification rows
 * Why: Scheduled announcements are delivered without a client request
 */
package com.evenza.notification.service;

import com.evenza.notification.config.NotificationDispatchProperties;
import com.evenza.notification.config.NotificationSweepProperties;
import com.evenza.notification.model.AnnouncementRecord;
import com.evenza.notification.model.DispatchRequest;
import com.evenza.notification.model.DispatchResult;
import com.evenza.notification.model.SweepResult;
import com.evenza.notification.repository.AnnouncementRepository;
import com.evenza.notification.repository.NotificationRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class AnnouncementSweepService {

  private static final Logger logger = LoggerFactory.getLogger(AnnouncementSweepService.class);

  /** created_by of rows written by the sweep. */
  public static final long SYSTEM_USER_ID = 0L;

  private final AnnouncementRepository announcementRepository;
  private final NotificationRepository notificationRepository;
  private final RecipientResolver recipientResolver;
  private final AnnouncementDispatcher dispatcher;
  private final NotificationSweepProperties sweepProperties;
  private final NotificationDispatchProperties dispatchProperties;
  private final NotificationMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  public SweepResult sweep() {
    final Instant now = Instant.now(clock);
    final List<AnnouncementRecord> due =
        announcementRepository.findDueScheduled(now, sweepProperties.batchSize());
    metrics.updateSweepDue(due.size());

    // One transaction per announcement so a failure never rolls back its neighbours.
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    int dispatched = 0;
    int failed = 0;
    for (AnnouncementRecord announcement : due) {
      try {
        final Boolean sent =
            transactionTemplate.execute(status -> dispatchDue(announcement, now, status));
        if (Boolean.TRUE.equals(sent)) {
          dispatched++;
        }
      } catch (RuntimeException ex) {
        failed++;
        handleFailure(announcement, ex, now);
      }
    }
    final int promoted = notificationRepository.promoteDueScheduled(now);
    metrics.recordSweepDuration(Duration.between(now, Instant.now(clock)));

    final SweepResult result = new SweepResult(due.size(), dispatched, failed, promoted);
    if (!result.isIdle()) {
      logger.info(
          "announcement sweep finished due={} dispatched={} failed={} promoted={}",
          result.due(),
          result.dispatched(),
          result.failed(),
          result.promoted());
    }
    return result;
  }

  private boolean dispatchDue(AnnouncementRecord announcement, Instant now, TransactionStatus status) {
    final long announcementId = announcement.announcementId();
    final List<Long> recipients = recipientResolver.resolveRecipients(announcement.eventId());
    final DispatchResult result =
        dispatcher.dispatch(
            recipients,
            DispatchRequest.sent(
                announcementId,
                announcement.eventId(),
                announcement.title(),
                announcement.message(),
                SYSTEM_USER_ID,
                announcement.createdBy()));
    if (announcementRepository.markScheduledSent(announcementId, now) == 0) {
      // Sent or edited by a request since it was selected.
      status.setRollbackOnly();
      logger.info("scheduled announcement no longer due announcementId={}", announcementId);
      return false;
    }
    logger.info(
        "scheduled announcement sent announcementId={} inserted={} requested={}",
        announcementId,
        result.inserted(),
        result.requested());
    return true;
  }

  /** Records the failure; the announcement stays Scheduled and is retried on the next sweep. */
  @VisibleForTesting
  void handleFailure(AnnouncementRecord announcement, RuntimeException ex, Instant now) {
    final int attempt = announcement.dispatchAttempts() + 1;
    logger.warn(
        "scheduled announcement dispatch failed announcementId={} attempt={}",
        announcement.announcementId(),
        attempt,
        ex);
    try {
      announcementRepository.recordDispatchFailure(
          announcement.announcementId(), truncateError(ex.getMessage()), now);
    } catch (DataAccessException recordEx) {
      logger.warn(
          "failed to record dispatch failure announcementId={}",
          announcement.announcementId(),
          recordEx);
    }
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = dispatchProperties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
