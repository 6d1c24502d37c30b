package com.remindme.backend.command.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DayReference {
  TODAY("today"),
  TOMORROW("tomorrow"),
  DAY_AFTER_TOMORROW("day_after_tomorrow"),
  WEEKDAY("weekday"),
  SPECIFIC_DATE("specific_date");

  private final String value;

  DayReference(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static DayReference fromValue(String raw) {
    if (raw == null) {
      return null;
    }
    for (DayReference reference : values()) {
      if (reference.value.equalsIgnoreCase(raw.trim())) {
        return reference;
      }
    }
    throw new IllegalArgumentException("Unknown day reference: " + raw);
  }
}
