package com.remindme.backend.command.model;

import com.remindme.backend.reminder.domain.RecurrenceRule;
import java.time.LocalTime;
import java.util.Objects;

/** One reminder of a create command; {@code time} and {@code recurrence} are optional. */
public record ReminderSpec(String title, DaySpec day, LocalTime time, RecurrenceRule recurrence) {

  public ReminderSpec {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(day, "day");
  }

  public static ReminderSpec of(String title, DaySpec day) {
    return new ReminderSpec(title, day, null, null);
  }

  public static ReminderSpec at(String title, DaySpec day, LocalTime time) {
    return new ReminderSpec(title, day, time, null);
  }

  public ReminderSpec repeating(RecurrenceRule rule) {
    return new ReminderSpec(title, day, time, rule);
  }
}
