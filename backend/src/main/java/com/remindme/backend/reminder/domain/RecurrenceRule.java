package com.remindme.backend.reminder.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.time.Instant;

/**
 * Repeat specification of a reminder series. {@code maxOccurrences} counts every occurrence of the
 * series including the first one; {@code endsAt} is the last instant an occurrence may be due at.
 * At most one end condition is set.
 */
@Embeddable
public record RecurrenceRule(
    @Enumerated(EnumType.STRING) @Column(name = "recurrence_frequency", length = 16)
        RecurrenceFrequency frequency,
    @Column(name = "recurrence_interval") Integer interval,
    @Column(name = "recurrence_max_occurrences") Integer maxOccurrences,
    @Column(name = "recurrence_ends_at") Instant endsAt) {

  public static RecurrenceRule every(RecurrenceFrequency frequency, int interval) {
    return new RecurrenceRule(frequency, interval, null, null);
  }

  public RecurrenceRule withMaxOccurrences(int maxOccurrences) {
    return new RecurrenceRule(frequency, interval, maxOccurrences, null);
  }

  public RecurrenceRule withEndsAt(Instant endsAt) {
    return new RecurrenceRule(frequency, interval, null, endsAt);
  }

  public boolean hasEndCondition() {
    return maxOccurrences != null || endsAt != null;
  }

  public String describe() {
    StringBuilder builder = new StringBuilder(frequency.value());
    if (interval != null && interval > 1) {
      builder.append(" x").append(interval);
    }
    if (maxOccurrences != null) {
      builder.append(", ").append(maxOccurrences).append(" раз");
    } else if (endsAt != null) {
      builder.append(", до ").append(endsAt);
    }
    return builder.toString();
  }
}
