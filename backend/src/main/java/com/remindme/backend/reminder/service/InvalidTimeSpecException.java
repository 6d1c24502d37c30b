package com.remindme.backend.reminder.service;

import com.remindme.backend.command.service.CommandValidationException;
import com.remindme.backend.command.service.FieldViolation;
import java.util.List;

/** A requested day/time that does not resolve to an instant strictly in the future. */
public class InvalidTimeSpecException extends CommandValidationException {

  public InvalidTimeSpecException(String field, String message) {
    super(field, "FutureTime", message);
  }

  public InvalidTimeSpecException(List<FieldViolation> violations) {
    super(violations);
  }

  /** Same violations with every field path prefixed, e.g. {@code time -> reminders[1].time}. */
  public InvalidTimeSpecException under(String prefix) {
    return new InvalidTimeSpecException(
        getViolations().stream()
            .map(v -> new FieldViolation(prefix + "." + v.field(), v.rule(), v.message()))
            .toList());
  }
}
