package com.remindme.backend.reminder.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RecurrenceFrequency {
  HOURLY("hourly"),
  DAILY("daily"),
  WEEKLY("weekly"),
  MONTHLY("monthly");

  private final String value;

  RecurrenceFrequency(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static RecurrenceFrequency fromValue(String raw) {
    if (raw == null) {
      return null;
    }
    for (RecurrenceFrequency frequency : values()) {
      if (frequency.value.equalsIgnoreCase(raw.trim())) {
        return frequency;
      }
    }
    throw new IllegalArgumentException("Unknown recurrence frequency: " + raw);
  }
}
