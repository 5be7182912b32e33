package com.evenza.notification.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

class AnnouncementStatusTest {

  @ParameterizedTest
  @CsvSource({
    "draft, DRAFT",
    "Draft, DRAFT",
    "pending, DRAFT",
    "SCHEDULED, SCHEDULED",
    "scheduled, SCHEDULED",
    "Sent, SENT",
    "archived, DRAFT"
  })
  void fromInputIsCaseInsensitiveAndFallsBackToDraft(String raw, AnnouncementStatus expected) {
    assertThat(AnnouncementStatus.fromInput(raw)).isEqualTo(expected);
  }

  @ParameterizedTest
  @NullAndEmptySource
  void fromInputTreatsMissingAsDraft(String raw) {
    assertThat(AnnouncementStatus.fromInput(raw)).isEqualTo(AnnouncementStatus.DRAFT);
  }

  @Test
  void mapsBetweenBothStoredVocabularies() {
    assertThat(AnnouncementStatus.DRAFT.toAnnouncementColumn()).isEqualTo("Draft");
    assertThat(AnnouncementStatus.DRAFT.toNotificationColumn()).isEqualTo("pending");
    assertThat(AnnouncementStatus.SCHEDULED.toNotificationColumn()).isEqualTo("scheduled");
    assertThat(AnnouncementStatus.SENT.toClientValue()).isEqualTo("Sent");
    assertThat(AnnouncementStatus.fromAnnouncementColumn("Scheduled"))
        .isEqualTo(AnnouncementStatus.SCHEDULED);
    assertThat(AnnouncementStatus.fromNotificationColumn("pending"))
        .isEqualTo(AnnouncementStatus.DRAFT);
    assertThat(AnnouncementStatus.fromNotificationColumn("sent")).isEqualTo(AnnouncementStatus.SENT);
  }

  @Test
  void rejectsUnknownColumnValues() {
    assertThatThrownBy(() -> AnnouncementStatus.fromAnnouncementColumn("sent"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> AnnouncementStatus.fromNotificationColumn("Draft"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rankOrdersSentAboveScheduledAboveDraft() {
    assertThat(AnnouncementStatus.fromRank(2)).isEqualTo(AnnouncementStatus.SENT);
    assertThat(AnnouncementStatus.fromRank(1)).isEqualTo(AnnouncementStatus.SCHEDULED);
    assertThat(AnnouncementStatus.fromRank(0)).isEqualTo(AnnouncementStatus.DRAFT);
    assertThat(AnnouncementStatus.SENT.rank()).isGreaterThan(AnnouncementStatus.SCHEDULED.rank());
    assertThat(AnnouncementStatus.SENT.isTerminal()).isTrue();
    assertThat(AnnouncementStatus.SCHEDULED.isTerminal()).isFalse();
  }

  @Test
  void notificationStatusParseIsStrict() {
    assertThat(NotificationStatus.parse(" Sent ")).contains(NotificationStatus.SENT);
    assertThat(NotificationStatus.parse("draft")).isEmpty();
    assertThat(NotificationStatus.parse(null)).isEmpty();
  }
}
