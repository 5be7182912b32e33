package com.evenza.notification.service;

import com.evenza.notification.api.InvalidAnnouncementRequestException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parses client supplied {@code scheduled_at} values. Accepts an ISO-8601 instant, an offset
 * date-time, or a local date-time which is read as UTC.
 */
final class ScheduleTimes {

  private ScheduleTimes() {}

  static Instant parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidAnnouncementRequestException("scheduled_at is required");
    }
    final TemporalAccessor parsed;
    try {
      parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              raw.trim(), OffsetDateTime::from, LocalDateTime::from);
    } catch (DateTimeParseException ex) {
      throw new InvalidAnnouncementRequestException("scheduled_at must be a valid datetime");
    }
    if (parsed instanceof OffsetDateTime offsetDateTime) {
      return offsetDateTime.toInstant();
    }
    return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
  }

  static Instant parseNotPast(String raw, Instant now) {
    final Instant scheduledAt = parse(raw);
    if (scheduledAt.isBefore(now)) {
      throw new InvalidAnnouncementRequestException("scheduled_at must not be in the past");
    }
    return scheduledAt;
  }
}
