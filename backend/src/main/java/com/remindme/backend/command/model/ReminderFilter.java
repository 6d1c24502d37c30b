package com.remindme.backend.command.model;

import com.remindme.backend.reminder.domain.ReminderStatus;
import java.time.Instant;
import java.util.Objects;

/**
 * Selection of a chat's reminders. Exactly the fields required by {@link #mode()} are set;
 * {@code INTERVAL} is the half-open range {@code [from, to)}.
 */
public record ReminderFilter(
    FilterMode mode, ReminderStatus status, String search, Instant from, Instant to, Long reminderId) {

  public ReminderFilter {
    Objects.requireNonNull(mode, "mode");
  }

  public static ReminderFilter all() {
    return new ReminderFilter(FilterMode.ALL, null, null, null, null, null);
  }

  public static ReminderFilter today() {
    return new ReminderFilter(FilterMode.TODAY, null, null, null, null, null);
  }

  public static ReminderFilter withStatus(ReminderStatus status) {
    return new ReminderFilter(FilterMode.STATUS, status, null, null, null, null);
  }

  public static ReminderFilter search(String text) {
    return new ReminderFilter(FilterMode.SEARCH, null, text, null, null, null);
  }

  public static ReminderFilter interval(Instant from, Instant to) {
    return new ReminderFilter(FilterMode.INTERVAL, null, null, from, to, null);
  }

  public static ReminderFilter byId(long reminderId) {
    return new ReminderFilter(FilterMode.ID, null, null, null, null, reminderId);
  }
}
