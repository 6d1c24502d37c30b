package com.remindme.backend.reminder.service;

import com.remindme.backend.reminder.domain.RecurrenceRule;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the next occurrence of a recurring reminder. Hourly steps are absolute; daily, weekly
 * and monthly steps move along the local calendar of the configured zone, so the wall-clock time
 * survives DST changes and month ends are clamped. Occurrences that already lie in the past are
 * skipped but still consume their index, so end conditions count them.
 */
public class RecurrenceCalculator {

  private final ZoneId zone;

  public RecurrenceCalculator(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public Optional<Occurrence> next(
      RecurrenceRule rule, Instant previousDueAt, int previousIndex, Instant now) {
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(previousDueAt, "previousDueAt");
    Objects.requireNonNull(now, "now");

    ZonedDateTime cursor = previousDueAt.atZone(zone);
    int index = previousIndex;
    do {
      cursor = step(cursor, rule);
      index++;
      if (!permits(rule, cursor.toInstant(), index)) {
        return Optional.empty();
      }
    } while (!cursor.toInstant().isAfter(now));
    return Optional.of(new Occurrence(cursor.toInstant(), index));
  }

  /** Whether the rule still allows an occurrence with this due time and 1-based index. */
  public boolean permits(RecurrenceRule rule, Instant dueAt, int index) {
    if (rule.maxOccurrences() != null && index > rule.maxOccurrences()) {
      return false;
    }
    return rule.endsAt() == null || !dueAt.isAfter(rule.endsAt());
  }

  private ZonedDateTime step(ZonedDateTime from, RecurrenceRule rule) {
    int interval = rule.interval();
    return switch (rule.frequency()) {
      case HOURLY -> from.plusHours(interval);
      case DAILY -> from.plusDays(interval);
      case WEEKLY -> from.plusWeeks(interval);
      case MONTHLY -> from.plusMonths(interval);
    };
  }

  public record Occurrence(Instant dueAt, int index) {}
}
