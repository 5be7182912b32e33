package com.evenza.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.evenza.notification.api.AnnouncementDispatchException;
import com.evenza.notification.model.DispatchRequest;
import com.evenza.notification.model.DispatchResult;
import com.evenza.notification.model.NotificationRecord;
import com.evenza.notification.model.NotificationStatus;
import com.evenza.notification.repository.NotificationRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class AnnouncementDispatcherTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private NotificationRepository notificationRepository;

  private SimpleMeterRegistry registry;
  private AnnouncementDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    dispatcher =
        new AnnouncementDispatcher(
            notificationRepository, new NotificationMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void emptyRecipientSetIsNotAnError() {
    final DispatchResult result =
        dispatcher.dispatch(List.of(), DispatchRequest.sent(5L, null, "T", "M", 3L, 3L));

    assertThat(result).isEqualTo(DispatchResult.empty());
    verifyNoInteractions(notificationRepository);
    assertThat(registry.get("announcement.dispatch.total").tag("result", "empty").counter().count())
        .isEqualTo(1.0);
  }

  @SuppressWarnings("unchecked")
  @Test
  void sentRowsAreUnreadInAppRowsStampedWithSentAt() {
    when(notificationRepository.insertAll(anyList())).thenReturn(2);

    final DispatchResult result =
        dispatcher.dispatch(List.of(7L, 9L), DispatchRequest.sent(5L, 42L, "T", "M", 0L, 3L));

    assertThat(result).isEqualTo(new DispatchResult(2, 2));
    final ArgumentCaptor<List<NotificationRecord>> captor = ArgumentCaptor.forClass(List.class);
    verify(notificationRepository).insertAll(captor.capture());
    assertThat(captor.getValue())
        .extracting(NotificationRecord::userId)
        .containsExactly(7L, 9L);
    assertThat(captor.getValue())
        .allSatisfy(
            row -> {
              assertThat(row.type()).isEqualTo("in-app");
              assertThat(row.read()).isFalse();
              assertThat(row.attempts()).isZero();
              assertThat(row.errorMessage()).isNull();
              assertThat(row.announcementId()).isEqualTo(5L);
              assertThat(row.createdBy()).isZero();
              assertThat(row.scheduledBy()).isEqualTo(3L);
              assertThat(row.sentAt()).isEqualTo(NOW);
            });
  }

  @SuppressWarnings("unchecked")
  @Test
  void pendingRowsHaveNoSentAt() {
    when(notificationRepository.insertAll(anyList())).thenReturn(1);

    dispatcher.dispatch(
        List.of(7L),
        new DispatchRequest(null, 42L, "T", "M", 3L, 3L, NotificationStatus.PENDING, null));

    final ArgumentCaptor<List<NotificationRecord>> captor = ArgumentCaptor.forClass(List.class);
    verify(notificationRepository).insertAll(captor.capture());
    assertThat(captor.getValue().get(0).sentAt()).isNull();
    assertThat(captor.getValue().get(0).status()).isEqualTo(NotificationStatus.PENDING);
  }

  @Test
  void skippedDuplicatesAreNotCounted() {
    when(notificationRepository.insertAll(anyList())).thenReturn(1);

    final DispatchResult result =
        dispatcher.dispatch(List.of(7L, 9L), DispatchRequest.sent(5L, 42L, "T", "M", 0L, 3L));

    assertThat(result.inserted()).isEqualTo(1);
    assertThat(result.requested()).isEqualTo(2);
  }

  @Test
  void storageFailureBecomesDispatchError() {
    when(notificationRepository.insertAll(anyList()))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    assertThatThrownBy(
            () -> dispatcher.dispatch(List.of(7L), DispatchRequest.sent(5L, 42L, "T", "M", 0L, 3L)))
        .isInstanceOf(AnnouncementDispatchException.class)
        .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    assertThat(registry.get("announcement.dispatch.total").tag("result", "failed").counter().count())
        .isEqualTo(1.0);
  }
}
