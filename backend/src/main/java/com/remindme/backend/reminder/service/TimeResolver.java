package com.remindme.backend.reminder.service;

import com.remindme.backend.command.model.DayReference;
import com.remindme.backend.command.model.DaySpec;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Maps a requested day and optional time to a concrete instant in the zone of {@code now}.
 *
 * <ul>
 *   <li>today without time: the next full hour strictly after {@code now};
 *   <li>a future day without time: that day at the default time (08:00);
 *   <li>a specific date without time: only a date after today;
 *   <li>an explicit time: combined with the resolved day as is.
 * </ul>
 *
 * A result that is not strictly after {@code now} is rejected with {@link
 * InvalidTimeSpecException}. The resolver reads no clock.
 */
public class TimeResolver {

  private final LocalTime defaultTime;

  public TimeResolver(LocalTime defaultTime) {
    this.defaultTime = Objects.requireNonNull(defaultTime, "defaultTime");
  }

  public ZonedDateTime resolve(ZonedDateTime now, DaySpec day, LocalTime time) {
    Objects.requireNonNull(now, "now");
    Objects.requireNonNull(day, "day");
    LocalDate today = now.toLocalDate();
    LocalDate date = resolveDate(today, day);

    if (date.isBefore(today)) {
      throw new InvalidTimeSpecException("date", "дата " + date + " уже прошла");
    }
    if (time == null && day.reference() == DayReference.SPECIFIC_DATE && !date.isAfter(today)) {
      throw new InvalidTimeSpecException("date", "дата без времени должна быть в будущем");
    }
    if (time == null && date.equals(today)) {
      return nextFullHour(now);
    }

    ZonedDateTime resolved =
        ZonedDateTime.of(date, time != null ? time : defaultTime, now.getZone());
    if (!resolved.isAfter(now)) {
      throw new InvalidTimeSpecException(
          "time", "время " + resolved.toLocalTime() + " сегодня уже прошло");
    }
    return resolved;
  }

  static ZonedDateTime nextFullHour(ZonedDateTime now) {
    return now.truncatedTo(ChronoUnit.HOURS).plusHours(1);
  }

  private LocalDate resolveDate(LocalDate today, DaySpec day) {
    return switch (day.reference()) {
      case TODAY -> today;
      case TOMORROW -> today.plusDays(1);
      case DAY_AFTER_TOMORROW -> today.plusDays(2);
      case WEEKDAY -> today.with(TemporalAdjusters.next(day.weekday()));
      case SPECIFIC_DATE -> day.date();
    };
  }
}
