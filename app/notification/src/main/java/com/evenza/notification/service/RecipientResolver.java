/*
 * Where: Notification service layer
 * What: Resolves an event reference and the registrants who receive its announcements
 * Why: Clients address events by id, by numeric string or by exact title
 */
package com.evenza.notification.service;

import com.evenza.notification.repository.EventRepository;
import com.evenza.notification.repository.RegistrationRepository;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RecipientResolver {

  private final EventRepository eventRepository;
  private final RegistrationRepository registrationRepository;

  /**
   * A numeric {@code eventId} wins. Otherwise a numeric-looking title is taken as an id and any
   * other title is matched exactly against {@code events.title}.
   */
  public Optional<Long> resolveEventId(String eventId, String eventTitle) {
    final Optional<Long> byId = parseId(eventId);
    if (byId.isPresent()) {
      return byId;
    }
    if (eventTitle == null || eventTitle.isBlank()) {
      return Optional.empty();
    }
    final String title = eventTitle.trim();
    final Optional<Long> numericTitle = parseId(title);
    if (numericTitle.isPresent()) {
      return numericTitle;
    }
    return eventRepository.findIdByTitle(title);
  }

  /** Distinct registrants of the event; empty when there is no event. */
  public List<Long> resolveRecipients(Long eventId) {
    if (eventId == null) {
      return List.of();
    }
    return registrationRepository.findDistinctUserIdsByEventId(eventId);
  }

  static Optional<Long> parseId(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(raw.trim()));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }
}
