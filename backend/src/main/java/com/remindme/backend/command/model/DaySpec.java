package com.remindme.backend.command.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Objects;

public record DaySpec(DayReference reference, DayOfWeek weekday, LocalDate date) {

  public DaySpec {
    Objects.requireNonNull(reference, "reference");
    if ((reference == DayReference.WEEKDAY) != (weekday != null)) {
      throw new IllegalArgumentException("weekday must be set exactly for day=weekday");
    }
    if ((reference == DayReference.SPECIFIC_DATE) != (date != null)) {
      throw new IllegalArgumentException("date must be set exactly for day=specific_date");
    }
  }

  public static DaySpec today() {
    return new DaySpec(DayReference.TODAY, null, null);
  }

  public static DaySpec tomorrow() {
    return new DaySpec(DayReference.TOMORROW, null, null);
  }

  public static DaySpec dayAfterTomorrow() {
    return new DaySpec(DayReference.DAY_AFTER_TOMORROW, null, null);
  }

  public static DaySpec next(DayOfWeek weekday) {
    return new DaySpec(DayReference.WEEKDAY, weekday, null);
  }

  public static DaySpec on(LocalDate date) {
    return new DaySpec(DayReference.SPECIFIC_DATE, null, date);
  }

  public boolean isToday() {
    return reference == DayReference.TODAY;
  }
}
